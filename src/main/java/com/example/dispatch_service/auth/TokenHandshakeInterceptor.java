package com.example.dispatch_service.auth;

import com.example.dispatch_service.config.DispatchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * 핸드셰이크 시 쿼리 파라미터의 토큰을 사용자로 바꿔 세션 속성에 넣는다.
 * 인증 결과와 상관없이 핸드셰이크는 항상 진행시킨다.
 */
@Component
@RequiredArgsConstructor
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    public static final String PRINCIPAL_ATTRIBUTE = "dispatch.principal";

    private final TrustGate trustGate;
    private final DispatchProperties properties;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String token = extractToken(request);
        attributes.put(PRINCIPAL_ATTRIBUTE, trustGate.resolve(token));
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }

    private String extractToken(ServerHttpRequest request) {
        String raw = UriComponentsBuilder.fromUri(request.getURI())
                                         .build()
                                         .getQueryParams()
                                         .getFirst(properties.getAuth().getTokenParameter());
        return raw == null ? null : UriUtils.decode(raw, StandardCharsets.UTF_8);
    }
}
