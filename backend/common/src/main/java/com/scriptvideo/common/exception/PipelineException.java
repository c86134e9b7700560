package com.scriptvideo.common.exception;

import lombok.Getter;

/**
 * 파이프라인 단계에서 발생하는 예상된 실패
 * 작업을 FAILED 로 전이시키고 JobError 로 저장된다.
 * diagnostic 에는 외부 시스템(모델 API, 인코더)의 원문 메시지를 담는다.
 */
@Getter
public class PipelineException extends Exception {

    private final ErrorCode errorCode;
    private final String diagnostic;

    public PipelineException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public PipelineException(ErrorCode errorCode, String message, String diagnostic) {
        this(errorCode, message, diagnostic, null);
    }

    public PipelineException(ErrorCode errorCode, String message, String diagnostic, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.diagnostic = diagnostic;
    }
}
