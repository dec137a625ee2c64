package com.example.dispatch_service.dto;

import com.example.dispatch_service.entity.TripStatus;

/**
 * 여정 변경 요청. null 인 필드는 기존 값을 유지한다.
 */
public record TripUpdate(
        String pickup,
        String dropoff,
        TripStatus status,
        String driverId
) {
    public boolean changesRoute() {
        return pickup != null || dropoff != null;
    }
}
