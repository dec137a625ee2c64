package com.example.dispatch_service.storage;

import com.example.dispatch_service.dto.NewTrip;
import com.example.dispatch_service.dto.TripRecord;
import com.example.dispatch_service.dto.TripUpdate;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 여정 저장소. 모든 메서드는 장애 시 {@link com.example.dispatch_service.exception.StorageUnavailableException}.
 */
public interface TripStorage {

    /** 상태 REQUESTED, 기사 없음으로 생성한다. */
    TripRecord createTrip(NewTrip trip);

    Optional<TripRecord> findTrip(String tripId);

    /**
     * 현재 값을 잠근 상태로 {@code change}에 넘기고, 돌려받은 변경을 같은 트랜잭션에서 반영한다.
     * 같은 여정에 대한 동시 수정은 직렬화된다.
     *
     * @throws com.example.dispatch_service.exception.TripNotFoundException 여정이 없을 때
     */
    TripRecord updateTrip(String tripId, Function<TripRecord, TripUpdate> change);

    /** 사용자가 승객이나 기사로 참여 중인, 완료되지 않은 여정들. */
    List<TripRecord> findActiveTrips(String participantId);
}
