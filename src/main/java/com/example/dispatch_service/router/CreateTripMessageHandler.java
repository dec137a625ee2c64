package com.example.dispatch_service.router;

import com.example.dispatch_service.config.DispatchProperties;
import com.example.dispatch_service.dto.CreateTripRequest;
import com.example.dispatch_service.dto.TripRecord;
import com.example.dispatch_service.message.InboundMessage;
import com.example.dispatch_service.message.MessageTypes;
import com.example.dispatch_service.message.OutboundMessage;
import com.example.dispatch_service.service.TripStateMachine;
import com.example.dispatch_service.session.DispatchSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CreateTripMessageHandler implements MessageHandler {

    private final TripStateMachine tripStateMachine;
    private final PayloadReader payloadReader;
    private final DispatchProperties properties;

    @Override
    public String type() {
        return MessageTypes.CREATE_TRIP;
    }

    @Override
    public void handle(DispatchSession session, InboundMessage message) {
        CreateTripRequest request = payloadReader.read(message.data(), CreateTripRequest.class);

        TripRecord trip = tripStateMachine.create(request.pickup(), request.dropoff(), request.rider(),
                session.getPrincipal());

        OutboundMessage outbound = new OutboundMessage(MessageTypes.CREATE_TRIP, trip);

        // 승객은 새 여정 그룹에 가입해 이후 변경 알림을 받는다
        session.join(trip.id());
        session.reply(outbound);

        // 대기 중인 모든 기사에게 새 호출 알림
        session.broadcast(properties.getDriverPoolGroup(), outbound);
    }
}
