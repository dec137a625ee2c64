package com.example.dispatch_service.exception;

public class StorageUnavailableException extends DispatchException {
    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UNAVAILABLE, message, cause);
    }
}
