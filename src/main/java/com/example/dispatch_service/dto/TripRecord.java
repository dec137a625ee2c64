package com.example.dispatch_service.dto;

import com.example.dispatch_service.entity.Trip;
import com.example.dispatch_service.entity.TripStatus;
import lombok.Builder;

import java.time.LocalDateTime;

/**
 * 여정 스냅샷. 그룹 브로드캐스트의 data 로 그대로 직렬화된다.
 */
@Builder(toBuilder = true)
public record TripRecord(
        String id,
        String pickup,
        String dropoff,
        TripStatus status,
        ParticipantRecord rider,
        ParticipantRecord driver,
        LocalDateTime created,
        LocalDateTime updated
) {
    public static TripRecord fromEntity(Trip trip) {
        return TripRecord.builder()
                         .id(trip.getTripId())
                         .pickup(trip.getPickup())
                         .dropoff(trip.getDropoff())
                         .status(trip.getStatus())
                         .rider(ParticipantRecord.fromEntity(trip.getRider()))
                         .driver(ParticipantRecord.fromEntity(trip.getDriver()))
                         .created(trip.getCreatedAt())
                         .updated(trip.getUpdatedAt())
                         .build();
    }

    public boolean isRider(String userId) {
        return rider != null && rider.id().equals(userId);
    }

    public boolean isDriver(String userId) {
        return driver != null && driver.id().equals(userId);
    }

    public boolean involves(String userId) {
        return isRider(userId) || isDriver(userId);
    }
}
