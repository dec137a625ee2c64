package com.example.dispatch_service.exception;

public class ParticipationDeniedException extends DispatchException {
    public ParticipationDeniedException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
