package com.example.dispatch_service.router;

import com.example.dispatch_service.exception.DispatchException;
import com.example.dispatch_service.exception.ErrorCode;
import com.example.dispatch_service.message.InboundMessage;
import com.example.dispatch_service.message.OutboundMessage;
import com.example.dispatch_service.session.DispatchSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 메시지 타입 → 핸들러 디스패치 테이블.
 * 모든 오류는 보낸 연결에게만 error 메시지로 돌려주고, 연결은 유지한다.
 */
@Component
@Slf4j
public class MessageRouter {

    private final Map<String, MessageHandler> handlers;
    private final ObjectMapper objectMapper;

    public MessageRouter(List<MessageHandler> handlers, ObjectMapper objectMapper) {
        this.handlers = handlers.stream()
                                .collect(Collectors.toUnmodifiableMap(MessageHandler::type, Function.identity()));
        // 소수는 double 로 바꾸지 않고 원문 자릿수 그대로 유지 (1.10 은 1.10)
        this.objectMapper = objectMapper.copy()
                                        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                                        .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false)
                                        .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
    }

    public void route(DispatchSession session, String payload) {
        InboundMessage message;
        try {
            message = objectMapper.readValue(payload, InboundMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("잘못된 메시지 형식. Connection ID: {}, payload: {}", session.id(), payload);
            session.reply(OutboundMessage.error(ErrorCode.VALIDATION_ERROR, "메시지는 {type, data} 형식의 JSON 이어야 합니다.", null));
            return;
        }
        if (message == null || message.type() == null || message.type().isBlank()) {
            session.reply(OutboundMessage.error(ErrorCode.VALIDATION_ERROR, "메시지 타입은 필수입니다.", null));
            return;
        }

        MessageHandler handler = handlers.get(message.type());
        if (handler == null) {
            log.warn("알 수 없는 메시지 타입 수신: {} (Connection ID: {})", message.type(), session.id());
            session.reply(OutboundMessage.error(ErrorCode.VALIDATION_ERROR,
                    "지원하지 않는 메시지 타입입니다: " + message.type(), message.type()));
            return;
        }

        try {
            handler.handle(session, message);
        } catch (DispatchException e) {
            log.warn("메시지 처리 실패. type: {}, code: {}, message: {}", message.type(), e.getErrorCode(), e.getMessage());
            session.reply(OutboundMessage.error(e, message.type()));
        } catch (RuntimeException e) {
            log.error("메시지 처리 중 예기치 못한 오류. type: {}, Connection ID: {}", message.type(), session.id(), e);
            session.reply(OutboundMessage.error(ErrorCode.INTERNAL_ERROR, "요청을 처리하지 못했습니다.", message.type()));
        }
    }
}
