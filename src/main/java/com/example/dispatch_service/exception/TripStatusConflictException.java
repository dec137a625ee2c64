package com.example.dispatch_service.exception;

public class TripStatusConflictException extends DispatchException {
    public TripStatusConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
