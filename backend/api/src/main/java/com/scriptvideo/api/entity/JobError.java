package com.scriptvideo.api.entity;

import com.scriptvideo.common.enums.JobStatus;
import com.scriptvideo.common.enums.ModelErrorKind;
import com.scriptvideo.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 작업 실패 정보
 * stage: 실패한 단계, kind: 모델 오류일 때만, diagnostic: 외부 시스템 원문 메시지
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobError {
    private JobStatus stage;
    private ErrorCode errorCode;
    private ModelErrorKind kind;
    private String message;
    private String diagnostic;
}
