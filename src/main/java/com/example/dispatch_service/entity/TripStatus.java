package com.example.dispatch_service.entity;

import com.example.dispatch_service.exception.InvalidMessageException;

import java.util.Arrays;

public enum TripStatus {
    REQUESTED,    // 승객 호출
    STARTED,      // 기사 배정 후 출발
    IN_PROGRESS,  // 운행 중
    COMPLETED;    // 운행 완료

    /**
     * 다음 상태로의 정상 전이 여부. 같은 상태 유지는 전이로 보지 않는다.
     */
    public boolean canAdvanceTo(TripStatus next) {
        return next.ordinal() == this.ordinal() + 1;
    }

    public static TripStatus from(String value) {
        return Arrays.stream(values())
                     .filter(status -> status.name().equals(value))
                     .findFirst()
                     .orElseThrow(() -> new InvalidMessageException("알 수 없는 여정 상태입니다: " + value));
    }
}
