package com.example.dispatch_service.auth;

import com.example.dispatch_service.config.DispatchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 인증 서비스가 발급한 액세스 토큰은 Redis 에 "token:{token}" → userId 로 TTL 과 함께 저장된다.
 * 키가 없으면 잘못됐거나 만료된 토큰이다.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RedisTokenVerifier implements TokenVerifier {

    private final StringRedisTemplate redisTemplate;
    private final DispatchProperties properties;

    @Override
    public Optional<String> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String userId = redisTemplate.opsForValue().get(properties.getAuth().getTokenKeyPrefix() + token.trim());
        if (userId == null || userId.isBlank()) {
            log.debug("유효하지 않거나 만료된 토큰");
            return Optional.empty();
        }
        return Optional.of(userId);
    }
}
