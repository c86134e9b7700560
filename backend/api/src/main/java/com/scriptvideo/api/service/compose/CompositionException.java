package com.scriptvideo.api.service.compose;

import com.scriptvideo.common.exception.ErrorCode;
import com.scriptvideo.common.exception.PipelineException;

/**
 * 영상 합성 실패 (인코더 실패, 지원하지 않는 코덱, 길이 불일치)
 * diagnostic 에 인코더 출력 원문을 담는다.
 */
public class CompositionException extends PipelineException {

    public CompositionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public CompositionException(ErrorCode errorCode, String message, String diagnostic) {
        super(errorCode, message, diagnostic);
    }

    public CompositionException(ErrorCode errorCode, String message, String diagnostic, Throwable cause) {
        super(errorCode, message, diagnostic, cause);
    }
}
