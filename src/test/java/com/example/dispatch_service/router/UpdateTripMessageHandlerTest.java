package com.example.dispatch_service.router;

import com.example.dispatch_service.auth.UserPrincipal;
import com.example.dispatch_service.dto.ParticipantRecord;
import com.example.dispatch_service.dto.TripRecord;
import com.example.dispatch_service.dto.TripUpdate;
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
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class UpdateTripMessageHandlerTest {

    private static final UserPrincipal DRIVER = new UserPrincipal("driver-1", UserRole.DRIVER, true);

    @Mock
    private TripStateMachine tripStateMachine;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private UpdateTripMessageHandler handler;
    private InMemoryGroupRegistry registry;

    @BeforeEach
    void setUp() {
        PayloadReader payloadReader = new PayloadReader(objectMapper,
                Validation.buildDefaultValidatorFactory().getValidator());
        handler = new UpdateTripMessageHandler(tripStateMachine, payloadReader);
        registry = new InMemoryGroupRegistry();
    }

    @Test
    @DisplayName("기사 배정: 변경 결과를 여정 그룹 전체에 알리고 기사도 그룹에 가입한다")
    void handle_AssignDriver() throws Exception {
        // given
        RecordingConnection riderConnection = new RecordingConnection();
        RecordingConnection driverConnection = new RecordingConnection();
        registry.join("trip-1", riderConnection);
        DispatchSession session = new DispatchSession(driverConnection, DRIVER, registry);

        TripUpdate expected = new TripUpdate(null, null, TripStatus.STARTED, "driver-1");
        TripRecord updated = TripRecord.builder().id("trip-1").status(TripStatus.STARTED).build();
        given(tripStateMachine.update("trip-1", expected, DRIVER)).willReturn(updated);

        // when
        handler.handle(session, message("{\"id\":\"trip-1\",\"status\":\"STARTED\",\"driver\":\"driver-1\"}"));

        // then
        OutboundMessage toRider = riderConnection.receive();
        assertThat(toRider.type()).isEqualTo("update.trip");
        assertThat(toRider.data()).isEqualTo(updated);
        assertThat(driverConnection.receive().type()).isEqualTo("update.trip");
        assertThat(session.isMemberOf("trip-1")).isTrue();
    }

    @Test
    @DisplayName("기사 재배정: 교체된 기사의 연결도 재배정 알림을 받는다 (그룹은 재접속 때 정리)")
    void handle_ReassignDriver_PreviousDriverNotified() throws Exception {
        // given: 기존 기사(driver-1)가 여정 그룹에 있는 상태에서 관리자가 driver-2 로 교체
        UserPrincipal owner = new UserPrincipal("owner-1", UserRole.OWNER, true);
        RecordingConnection previousDriver = new RecordingConnection();
        RecordingConnection ownerConnection = new RecordingConnection();
        registry.join("trip-1", previousDriver);
        DispatchSession session = new DispatchSession(ownerConnection, owner, registry);

        TripUpdate expected = new TripUpdate(null, null, null, "driver-2");
        TripRecord reassigned = TripRecord.builder()
                                          .id("trip-1")
                                          .status(TripStatus.STARTED)
                                          .driver(new ParticipantRecord("driver-2", "0100000003", null, null, UserRole.DRIVER))
                                          .build();
        given(tripStateMachine.update("trip-1", expected, owner)).willReturn(reassigned);

        // when
        handler.handle(session, message("{\"id\":\"trip-1\",\"driver\":\"driver-2\"}"));

        // then
        OutboundMessage notice = previousDriver.receive();
        assertThat(notice.type()).isEqualTo("update.trip");
        assertThat(((TripRecord) notice.data()).isDriver("driver-1")).isFalse();
        assertThat(registry.members("trip-1")).contains(previousDriver, ownerConnection);
    }

    @Test
    @DisplayName("빈 기사 ID 는 변경하지 않음으로 처리된다")
    void handle_BlankDriver_Unchanged() throws Exception {
        DispatchSession session = new DispatchSession(new RecordingConnection(), DRIVER, registry);
        TripUpdate expected = new TripUpdate("새 출발지", null, null, null);
        given(tripStateMachine.update("trip-1", expected, DRIVER))
                .willReturn(TripRecord.builder().id("trip-1").status(TripStatus.REQUESTED).build());

        handler.handle(session, message("{\"id\":\"trip-1\",\"pickup\":\"새 출발지\",\"driver\":\" \"}"));

        then(tripStateMachine).should().update("trip-1", expected, DRIVER);
    }

    @Test
    @DisplayName("알 수 없는 상태 값이나 빈 여정 ID 는 검증 오류")
    void handle_InvalidInput() {
        DispatchSession session = new DispatchSession(new RecordingConnection(), DRIVER, registry);

        assertThatThrownBy(() -> handler.handle(session, message("{\"id\":\"trip-1\",\"status\":\"FLYING\"}")))
                .isInstanceOf(InvalidMessageException.class);
        assertThatThrownBy(() -> handler.handle(session, message("{\"status\":\"STARTED\"}")))
                .isInstanceOf(InvalidMessageException.class)
                .hasMessageContaining("여정 ID");
        then(tripStateMachine).shouldHaveNoInteractions();
    }

    private InboundMessage message(String data) throws Exception {
        return new InboundMessage("update.trip", objectMapper.readTree(data), null);
    }
}
