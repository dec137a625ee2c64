package com.example.dispatch_service.auth;

import com.example.dispatch_service.storage.UserStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 토큰 → 사용자 식별. 입장 허용 여부는 판단하지 않는다 ({@link AdmissionPolicy} 담당).
 * 어떤 실패도 예외로 던지지 않고 익명으로 떨어진다.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TrustGate {

    private final TokenVerifier tokenVerifier;
    private final UserStorage userStorage;

    public UserPrincipal resolve(String token) {
        if (token == null || token.isBlank()) {
            return UserPrincipal.anonymous();
        }

        Optional<String> subject;
        try {
            subject = tokenVerifier.verify(token);
        } catch (RuntimeException e) {
            log.error("토큰 검증 서비스 호출 실패. 익명으로 처리합니다. error: {}", e.getMessage());
            return UserPrincipal.anonymous();
        }
        if (subject.isEmpty()) {
            return UserPrincipal.anonymous();
        }

        Optional<UserPrincipal> principal;
        try {
            principal = userStorage.findPrincipal(subject.get());
        } catch (RuntimeException e) {
            log.error("사용자 조회 실패. 익명으로 처리합니다. userId: {}, error: {}", subject.get(), e.getMessage());
            return UserPrincipal.anonymous();
        }

        if (principal.isEmpty()) {
            log.warn("토큰의 사용자가 존재하지 않음. userId: {}", subject.get());
            return UserPrincipal.anonymous();
        }
        if (!principal.get().active()) {
            log.warn("비활성 사용자 접속 시도. userId: {}", subject.get());
            return UserPrincipal.anonymous();
        }
        return principal.get();
    }
}
