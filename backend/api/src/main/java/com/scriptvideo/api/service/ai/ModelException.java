package com.scriptvideo.api.service.ai;

import com.scriptvideo.common.enums.ModelErrorKind;
import com.scriptvideo.common.exception.ErrorCode;
import com.scriptvideo.common.exception.PipelineException;
import lombok.Getter;

/**
 * AI 모델 호출 실패 (분류된 오류)
 */
@Getter
public class ModelException extends PipelineException {

    private final ModelErrorKind kind;

    public ModelException(ModelErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ModelException(ModelErrorKind kind, String message, String diagnostic) {
        this(kind, message, diagnostic, null);
    }

    public ModelException(ModelErrorKind kind, String message, String diagnostic, Throwable cause) {
        super(errorCodeOf(kind), message, diagnostic, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    private static ErrorCode errorCodeOf(ModelErrorKind kind) {
        return switch (kind) {
            case UNAVAILABLE -> ErrorCode.MODEL_UNAVAILABLE;
            case RATE_LIMITED -> ErrorCode.MODEL_RATE_LIMITED;
            case CONTENT_POLICY_REJECTED -> ErrorCode.MODEL_CONTENT_POLICY;
            case TIMEOUT -> ErrorCode.MODEL_TIMEOUT;
            case MALFORMED_RESPONSE -> ErrorCode.MODEL_MALFORMED_RESPONSE;
        };
    }
}
