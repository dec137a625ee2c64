package com.example.dispatch_service.router;

import com.example.dispatch_service.entity.UserRole;
import com.example.dispatch_service.exception.ParticipationDeniedException;
import com.example.dispatch_service.message.InboundMessage;
import com.example.dispatch_service.message.MessageTypes;
import com.example.dispatch_service.message.OutboundMessage;
import com.example.dispatch_service.session.DispatchSession;
import org.springframework.stereotype.Component;

/**
 * 연결 생존 확인용 루프백. data 를 그대로 돌려준다.
 * OWNER 는 group 을 지정해 해당 그룹으로 보낼 수 있다 (운영/테스트용).
 */
@Component
public class EchoMessageHandler implements MessageHandler {

    @Override
    public String type() {
        return MessageTypes.ECHO;
    }

    @Override
    public void handle(DispatchSession session, InboundMessage message) {
        OutboundMessage echo = new OutboundMessage(MessageTypes.ECHO, message.data());

        if (message.group() == null) {
            session.reply(echo);
            return;
        }
        if (!session.getPrincipal().hasRole(UserRole.OWNER)) {
            throw new ParticipationDeniedException("그룹 지정 echo 는 관리자만 사용할 수 있습니다.");
        }
        session.broadcast(message.group(), echo);
    }
}
