package com.example.dispatch_service.handler;

import com.example.dispatch_service.group.Connection;
import com.example.dispatch_service.message.OutboundMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * WebSocket 세션 기반 연결. 세션은 {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}
 * 로 감싸져 있어 여러 스레드가 동시에 전송해도 안전하다.
 */
@Slf4j
public class WebSocketConnection implements Connection {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void deliver(OutboundMessage message) {
        if (!session.isOpen()) {
            log.debug("닫힌 연결로의 전송 생략. Connection ID: {}, type: {}", id(), message.type());
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(message);
            session.sendMessage(new TextMessage(payload));
        } catch (SessionLimitExceededException e) {
            log.warn("전송 버퍼 한도 초과로 연결이 종료되었습니다. Connection ID: {}, {}", id(), e.getMessage());
        } catch (IOException e) {
            log.error("메시지 전송 실패. Connection ID: {}, type: {}", id(), message.type(), e);
        }
    }
}
