package com.example.dispatch_service.router;

import com.example.dispatch_service.dto.TripRecord;
import com.example.dispatch_service.dto.TripUpdate;
import com.example.dispatch_service.dto.UpdateTripRequest;
import com.example.dispatch_service.entity.TripStatus;
import com.example.dispatch_service.message.InboundMessage;
import com.example.dispatch_service.message.MessageTypes;
import com.example.dispatch_service.message.OutboundMessage;
import com.example.dispatch_service.service.TripStateMachine;
import com.example.dispatch_service.session.DispatchSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UpdateTripMessageHandler implements MessageHandler {

    private final TripStateMachine tripStateMachine;
    private final PayloadReader payloadReader;

    @Override
    public String type() {
        return MessageTypes.UPDATE_TRIP;
    }

    @Override
    public void handle(DispatchSession session, InboundMessage message) {
        UpdateTripRequest request = payloadReader.read(message.data(), UpdateTripRequest.class);

        TripUpdate update = new TripUpdate(
                request.pickup(),
                request.dropoff(),
                request.status() == null ? null : TripStatus.from(request.status()),
                blankToNull(request.driver())
        );

        TripRecord trip = tripStateMachine.update(request.id(), update, session.getPrincipal());

        // 변경한 연결도 이후 이 여정의 알림을 받아야 함
        session.join(trip.id());
        session.broadcast(trip.id(), new OutboundMessage(MessageTypes.UPDATE_TRIP, trip));
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
