package com.example.dispatch_service.exception;

public class InvalidMessageException extends DispatchException {
    public InvalidMessageException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
