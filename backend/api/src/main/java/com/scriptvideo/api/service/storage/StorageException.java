package com.scriptvideo.api.service.storage;

import com.scriptvideo.common.exception.ErrorCode;
import com.scriptvideo.common.exception.PipelineException;

/**
 * 저장소 실패 (할당량 초과, 파일 I/O)
 */
public class StorageException extends PipelineException {

    public StorageException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public StorageException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause != null ? cause.getMessage() : null, cause);
    }
}
