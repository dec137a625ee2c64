package com.example.dispatch_service.auth;

import java.util.Optional;

/**
 * 외부 신뢰 서비스. 토큰을 검증하고 subject(사용자 ID)를 돌려준다.
 * 서명 오류, 만료, 형식 오류는 모두 empty.
 */
public interface TokenVerifier {

    Optional<String> verify(String token);
}
