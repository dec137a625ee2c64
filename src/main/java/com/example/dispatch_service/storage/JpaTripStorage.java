package com.example.dispatch_service.storage;

import com.example.dispatch_service.dto.NewTrip;
import com.example.dispatch_service.dto.TripRecord;
import com.example.dispatch_service.dto.TripUpdate;
import com.example.dispatch_service.entity.Trip;
import com.example.dispatch_service.entity.TripStatus;
import com.example.dispatch_service.entity.User;
import com.example.dispatch_service.entity.UserRole;
import com.example.dispatch_service.exception.InvalidMessageException;
import com.example.dispatch_service.exception.ParticipantNotFoundException;
import com.example.dispatch_service.exception.TripNotFoundException;
import com.example.dispatch_service.repository.TripRepository;
import com.example.dispatch_service.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

@Component
@Slf4j
@RequiredArgsConstructor
public class JpaTripStorage implements TripStorage {

    private final TripRepository tripRepository;
    private final UserRepository userRepository;
    private final StorageCallExecutor executor;

    @Override
    public TripRecord createTrip(NewTrip newTrip) {
        return executor.inTransaction("createTrip", status -> {
            User rider = newTrip.riderId() == null ? null : getUserOrThrow(newTrip.riderId());

            Trip trip = Trip.builder()
                            .tripId(UUID.randomUUID().toString())
                            .pickup(newTrip.pickup())
                            .dropoff(newTrip.dropoff())
                            .rider(rider)
                            .build();

            return TripRecord.fromEntity(tripRepository.save(trip));
        });
    }

    @Override
    public Optional<TripRecord> findTrip(String tripId) {
        return executor.inTransaction("findTrip",
                status -> tripRepository.findByTripId(tripId).map(TripRecord::fromEntity));
    }

    @Override
    public TripRecord updateTrip(String tripId, Function<TripRecord, TripUpdate> change) {
        return executor.inTransaction("updateTrip", status -> {
            Trip trip = tripRepository.findForUpdateByTripId(tripId)
                                      .orElseThrow(() -> new TripNotFoundException("여정 정보 없음: " + tripId));

            TripUpdate update = change.apply(TripRecord.fromEntity(trip));

            if (update.driverId() != null) {
                User driver = getUserOrThrow(update.driverId());
                if (driver.getRole() != UserRole.DRIVER) {
                    throw new InvalidMessageException("기사 역할이 아닌 사용자는 배정할 수 없습니다: " + update.driverId());
                }
                trip.assignDriver(driver);
            }
            if (update.changesRoute()) {
                trip.changeRoute(update.pickup(), update.dropoff());
            }
            if (update.status() != null) {
                trip.changeStatus(update.status());
            }

            return TripRecord.fromEntity(tripRepository.saveAndFlush(trip));
        });
    }

    @Override
    public List<TripRecord> findActiveTrips(String participantId) {
        return executor.inTransaction("findActiveTrips",
                status -> tripRepository.findParticipatingTrips(participantId, TripStatus.COMPLETED)
                                        .stream()
                                        .map(TripRecord::fromEntity)
                                        .toList());
    }

    private User getUserOrThrow(String userId) {
        return userRepository.findById(userId)
                             .orElseThrow(() -> new ParticipantNotFoundException("사용자 정보 없음: " + userId));
    }
}
