package com.example.dispatch_service.message;

public final class MessageTypes {

    public static final String ECHO = "echo.message";
    public static final String CREATE_TRIP = "create.trip";
    public static final String UPDATE_TRIP = "update.trip";
    public static final String ERROR = "error";

    private MessageTypes() {
    }
}
