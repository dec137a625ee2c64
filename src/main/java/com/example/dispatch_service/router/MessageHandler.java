package com.example.dispatch_service.router;

import com.example.dispatch_service.message.InboundMessage;
import com.example.dispatch_service.session.DispatchSession;

public interface MessageHandler {

    /** 처리할 메시지 타입 (예: create.trip) */
    String type();

    void handle(DispatchSession session, InboundMessage message);
}
