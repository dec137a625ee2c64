package com.example.dispatch_service.exception;

import lombok.Getter;

/**
 * 연결 단위로 처리되는 모든 배차 오류의 상위 타입.
 * 라우터가 {@link ErrorCode}를 보고 요청한 연결에게만 error 메시지를 돌려준다.
 */
@Getter
public abstract class DispatchException extends RuntimeException {

    private final ErrorCode errorCode;

    protected DispatchException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected DispatchException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
