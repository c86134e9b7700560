package com.scriptvideo.common.exception;

import lombok.Getter;

/**
 * 내부 불변식 위반 (허용되지 않은 상태 전이, 동시 수정 충돌 등)
 * 정상 동작 중에는 발생하지 않아야 하는 결함이다.
 */
@Getter
public class ConsistencyException extends RuntimeException {

    private final ErrorCode errorCode;

    public ConsistencyException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
