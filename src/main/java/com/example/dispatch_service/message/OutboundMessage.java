package com.example.dispatch_service.message;

import com.example.dispatch_service.exception.DispatchException;
import com.example.dispatch_service.exception.ErrorCode;

public record OutboundMessage(String type, Object data) {

    public record ErrorPayload(String code, String message, boolean retryable, String requestType) {}

    public static OutboundMessage error(DispatchException e, String requestType) {
        return error(e.getErrorCode(), e.getMessage(), requestType);
    }

    public static OutboundMessage error(ErrorCode code, String message, String requestType) {
        return new OutboundMessage(MessageTypes.ERROR,
                new ErrorPayload(code.name(), message, code.isRetryable(), requestType));
    }
}
