package com.example.dispatch_service.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(false),
    NOT_FOUND(false),
    FORBIDDEN(false),
    CONFLICT(false),
    UNAVAILABLE(true),   // 저장소 일시 장애. 클라이언트가 다시 시도할 수 있음
    INTERNAL_ERROR(false);

    private final boolean retryable;
}
