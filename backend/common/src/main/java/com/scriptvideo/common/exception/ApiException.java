package com.scriptvideo.common.exception;

import lombok.Getter;

import java.util.List;

/**
 * 요청 처리 중 동기적으로 발생하는 비즈니스 예외
 * (요청 검증 실패, 리소스 없음 등 - HTTP 응답으로 바로 변환됨)
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final List<String> details;     // 검증 실패 항목 (없으면 빈 목록)

    public ApiException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage(), List.of());
    }

    public ApiException(ErrorCode errorCode, String message) {
        this(errorCode, message, List.of());
    }

    public ApiException(ErrorCode errorCode, String message, List<String> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = List.copyOf(details);
    }

    public ApiException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = List.of();
    }
}
