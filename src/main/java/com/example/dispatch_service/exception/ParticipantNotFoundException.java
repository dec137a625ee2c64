package com.example.dispatch_service.exception;

public class ParticipantNotFoundException extends DispatchException {
    public ParticipantNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
