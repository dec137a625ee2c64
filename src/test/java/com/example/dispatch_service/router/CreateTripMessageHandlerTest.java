package com.example.dispatch_service.router;

import com.example.dispatch_service.auth.UserPrincipal;
import com.example.dispatch_service.config.DispatchProperties;
import com.example.dispatch_service.dto.TripRecord;
import com.example.dispatch_service.entity.TripStatus;
import com.example.dispatch_service.entity.UserRole;
import com.example.dispatch_service.exception.InvalidMessageException;
import com.example.dispatch_service.group.InMemoryGroupRegistry;
import com.example.dispatch_service.message.InboundMessage;
import com.example.dispatch_service.message.OutboundMessage;
import com.example.dispatch_service.service.TripStateMachine;
import com.example.dispatch_service.session.DispatchSession;
import com.example.dispatch_service.support.RecordingConnection;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class CreateTripMessageHandlerTest {

    private static final UserPrincipal RIDER = new UserPrincipal("rider-1", UserRole.RIDER, true);

    @Mock
    private TripStateMachine tripStateMachine;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CreateTripMessageHandler handler;
    private InMemoryGroupRegistry registry;

    @BeforeEach
    void setUp() {
        PayloadReader payloadReader = new PayloadReader(objectMapper,
                Validation.buildDefaultValidatorFactory().getValidator());
        handler = new CreateTripMessageHandler(tripStateMachine, payloadReader, new DispatchProperties());
        registry = new InMemoryGroupRegistry();
    }

    @Test
    @DisplayName("여정 생성: 승객에게 응답하고, 여정 그룹에 가입시키고, 기사 풀에 알린다")
    void handle_CreatesAndBroadcasts() throws Exception {
        // given
        RecordingConnection riderConnection = new RecordingConnection();
        RecordingConnection driverConnection = new RecordingConnection();
        registry.join("drivers", driverConnection);
        DispatchSession session = new DispatchSession(riderConnection, RIDER, registry);

        TripRecord created = TripRecord.builder().id("trip-1").pickup("A").dropoff("B")
                                       .status(TripStatus.REQUESTED).build();
        given(tripStateMachine.create("A", "B", null, RIDER)).willReturn(created);

        // when
        handler.handle(session, message("{\"pickup\":\"A\",\"dropoff\":\"B\"}"));

        // then
        OutboundMessage reply = riderConnection.receive();
        assertThat(reply.type()).isEqualTo("create.trip");
        assertThat(reply.data()).isEqualTo(created);
        assertThat(driverConnection.receive().data()).isEqualTo(created);
        assertThat(session.isMemberOf("trip-1")).isTrue();
    }

    @Test
    @DisplayName("출발지가 없으면 상태 머신을 호출하지 않고 검증 오류")
    void handle_MissingPickup() {
        DispatchSession session = new DispatchSession(new RecordingConnection(), RIDER, registry);

        assertThatThrownBy(() -> handler.handle(session, message("{\"dropoff\":\"B\"}")))
                .isInstanceOf(InvalidMessageException.class)
                .hasMessageContaining("출발지");
        then(tripStateMachine).should(org.mockito.Mockito.never()).create(any(), any(), any(), any());
    }

    @Test
    @DisplayName("data 가 객체가 아니면 검증 오류")
    void handle_DataNotObject() {
        DispatchSession session = new DispatchSession(new RecordingConnection(), RIDER, registry);

        assertThatThrownBy(() -> handler.handle(session, message("\"A to B\"")))
                .isInstanceOf(InvalidMessageException.class);
    }

    private InboundMessage message(String data) throws Exception {
        return new InboundMessage("create.trip", objectMapper.readTree(data), null);
    }
}
