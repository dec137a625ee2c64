package com.example.dispatch_service.exception;

public class TripNotFoundException extends DispatchException {
    public TripNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
