package com.example.dispatch_service.service;

import com.example.dispatch_service.auth.UserPrincipal;
import com.example.dispatch_service.config.DispatchProperties;
import com.example.dispatch_service.dto.NewTrip;
import com.example.dispatch_service.dto.TripRecord;
import com.example.dispatch_service.dto.TripUpdate;
import com.example.dispatch_service.entity.TripStatus;
import com.example.dispatch_service.entity.UserRole;
import com.example.dispatch_service.exception.InvalidMessageException;
import com.example.dispatch_service.exception.ParticipationDeniedException;
import com.example.dispatch_service.exception.TripStatusConflictException;
import com.example.dispatch_service.storage.TripStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 여정 생명주기: REQUESTED → STARTED → IN_PROGRESS → COMPLETED.
 * 저장은 {@link TripStorage}에 위임하고, 한 번의 전이를 검증하는 데 필요한 상태 외에는 들고 있지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripStateMachine {

    private final TripStorage tripStorage;
    private final DispatchProperties properties;

    public TripRecord create(String pickup, String dropoff, String riderId, UserPrincipal actor) {
        requireAuthenticated(actor);
        requireAddress("출발지", pickup);
        requireAddress("도착지", dropoff);

        String rider = riderId == null || riderId.isBlank() ? defaultRider(actor) : riderId;
        if (enforceParticipation() && !actor.hasRole(UserRole.OWNER) && !rider.equals(actor.id())) {
            throw new ParticipationDeniedException("다른 승객의 여정은 생성할 수 없습니다.");
        }

        TripRecord trip = tripStorage.createTrip(new NewTrip(pickup.strip(), dropoff.strip(), rider));
        log.info("여정 생성 완료. Trip ID: {}, Rider: {}", trip.id(), rider);
        return trip;
    }

    public TripRecord update(String tripId, TripUpdate requested, UserPrincipal actor) {
        requireAuthenticated(actor);

        TripRecord updated = tripStorage.updateTrip(tripId, current -> {
            authorize(current, requested, actor);
            checkTransition(current, requested.status());
            return requested;
        });

        log.info("여정 변경 완료. Trip ID: {}, 상태: {}, Driver: {}", updated.id(), updated.status(),
                updated.driver() == null ? null : updated.driver().id());
        return updated;
    }

    private void authorize(TripRecord current, TripUpdate requested, UserPrincipal actor) {
        if (!enforceParticipation() || actor.hasRole(UserRole.OWNER) || current.involves(actor.id())) {
            return;
        }
        // 배정되지 않은 여정을 기사가 자기 자신으로 수락하는 경우
        boolean claiming = actor.hasRole(UserRole.DRIVER)
                && current.driver() == null
                && actor.id().equals(requested.driverId());
        if (!claiming) {
            throw new ParticipationDeniedException("여정 참여자만 변경할 수 있습니다. Trip ID: " + current.id());
        }
    }

    private void checkTransition(TripRecord current, TripStatus next) {
        TripStatus from = current.status();
        if (next == null || next == from || from.canAdvanceTo(next)) {
            return;
        }
        if (properties.getTrips().isStrictTransitions()) {
            throw new TripStatusConflictException(
                    "허용되지 않는 상태 변경입니다. 현재 상태: " + from + ", 요청 상태: " + next);
        }
        log.warn("비정상 상태 전이 감지 (허용). Trip ID: {}, {} -> {}", current.id(), from, next);
    }

    private String defaultRider(UserPrincipal actor) {
        if (!actor.hasRole(UserRole.RIDER)) {
            throw new InvalidMessageException("승객 ID는 필수입니다.");
        }
        return actor.id();
    }

    private void requireAuthenticated(UserPrincipal actor) {
        if (actor.isAnonymous()) {
            throw new ParticipationDeniedException("인증된 사용자만 여정을 생성하거나 변경할 수 있습니다.");
        }
    }

    private void requireAddress(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidMessageException(field + "는 필수입니다.");
        }
    }

    private boolean enforceParticipation() {
        return properties.getTrips().isEnforceParticipation();
    }
}
