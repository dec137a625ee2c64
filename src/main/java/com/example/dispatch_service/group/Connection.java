package com.example.dispatch_service.group;

import com.example.dispatch_service.message.OutboundMessage;

/**
 * 그룹 레지스트리가 메시지를 전달하는 대상. 실제 구현은 WebSocket 세션을 감싼다.
 */
public interface Connection {

    String id();

    void deliver(OutboundMessage message);
}
