package com.example.dispatch_service.session;

import com.example.dispatch_service.auth.UserPrincipal;
import com.example.dispatch_service.config.DispatchProperties;
import com.example.dispatch_service.dto.TripRecord;
import com.example.dispatch_service.entity.UserRole;
import com.example.dispatch_service.exception.DispatchException;
import com.example.dispatch_service.group.Connection;
import com.example.dispatch_service.group.GroupRegistry;
import com.example.dispatch_service.storage.TripStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class DispatchSessionManager {

    private final GroupRegistry groupRegistry;
    private final TripStorage tripStorage;
    private final DispatchProperties properties;

    public DispatchSession open(Connection connection, UserPrincipal principal) {
        DispatchSession session = new DispatchSession(connection, principal, groupRegistry);

        if (principal.hasRole(UserRole.DRIVER)) {
            session.join(properties.getDriverPoolGroup());
        }
        if (!principal.isAnonymous()) {
            rejoinActiveTrips(session);
        }

        log.info("배차 세션 시작. Connection ID: {}, User: {}, Role: {}, Groups: {}",
                connection.id(), principal.getName(), principal.role(), session.groups());
        return session;
    }

    public void close(DispatchSession session) {
        session.close();
        log.info("배차 세션 종료. Connection ID: {}, User: {}", session.id(), session.getPrincipal().getName());
    }

    // 재접속 시 진행 중인 여정 그룹에 다시 가입하여 알림이 끊기지 않도록 함
    private void rejoinActiveTrips(DispatchSession session) {
        try {
            List<TripRecord> trips = tripStorage.findActiveTrips(session.getPrincipal().id());
            trips.forEach(trip -> session.join(trip.id()));
        } catch (DispatchException e) {
            log.warn("진행 중인 여정 조회 실패. 여정 그룹 없이 세션을 시작합니다. User: {}, error: {}",
                    session.getPrincipal().id(), e.getMessage());
        }
    }
}
