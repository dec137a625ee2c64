package com.example.dispatch_service.handler;

import com.example.dispatch_service.auth.AdmissionPolicy;
import com.example.dispatch_service.auth.TokenHandshakeInterceptor;
import com.example.dispatch_service.auth.UserPrincipal;
import com.example.dispatch_service.config.DispatchProperties;
import com.example.dispatch_service.router.MessageRouter;
import com.example.dispatch_service.session.DispatchSession;
import com.example.dispatch_service.session.DispatchSessionManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
@RequiredArgsConstructor
public class DispatchWebSocketHandler extends TextWebSocketHandler {

    private static final CloseStatus NOT_ADMITTED = CloseStatus.POLICY_VIOLATION.withReason("인증되지 않은 연결");

    private final Map<String, DispatchSession> sessions = new ConcurrentHashMap<>();

    private final AdmissionPolicy admissionPolicy;
    private final DispatchSessionManager sessionManager;
    private final MessageRouter messageRouter;
    private final ObjectMapper objectMapper;
    private final DispatchProperties properties;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        UserPrincipal principal = principalOf(session);

        if (!admissionPolicy.admit(principal)) {
            log.warn("입장 거부. Connection ID: {}, User: {}", session.getId(), principal.getName());
            session.close(NOT_ADMITTED);
            return;
        }

        WebSocketSession concurrentSession = new ConcurrentWebSocketSessionDecorator(
                session,
                (int) properties.getOutbound().getSendTimeLimit().toMillis(),
                properties.getOutbound().getBufferSizeLimit());

        DispatchSession dispatchSession = sessionManager.open(
                new WebSocketConnection(concurrentSession, objectMapper), principal);
        sessions.put(session.getId(), dispatchSession);

        // 세션 준비 중에 연결이 끊긴 경우 그룹 정리
        if (!session.isOpen() && sessions.remove(session.getId()) != null) {
            sessionManager.close(dispatchSession);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        DispatchSession dispatchSession = sessions.get(session.getId());
        if (dispatchSession == null) {
            log.debug("입장하지 않은 연결의 메시지 무시. Connection ID: {}", session.getId());
            return;
        }
        messageRouter.route(dispatchSession, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("전송 오류. Connection ID: {}, error: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        DispatchSession dispatchSession = sessions.remove(session.getId());
        if (dispatchSession != null) {
            sessionManager.close(dispatchSession);
        }
    }

    private UserPrincipal principalOf(WebSocketSession session) {
        Object attribute = session.getAttributes().get(TokenHandshakeInterceptor.PRINCIPAL_ATTRIBUTE);
        return attribute instanceof UserPrincipal principal ? principal : UserPrincipal.anonymous();
    }
}
