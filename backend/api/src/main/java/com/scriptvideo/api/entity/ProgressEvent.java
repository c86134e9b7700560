package com.scriptvideo.api.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scriptvideo.common.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 작업 진행 이벤트
 * sequenceNumber 는 작업별로 1부터 빈틈없이 증가한다.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressEvent {
    private String jobId;
    private long sequenceNumber;
    private JobStatus stage;
    private String message;
    private int percentage;
    private Long estimatedRemainingSeconds;
    private Map<String, Object> metrics;
    private ErrorContext errorContext;
    private LocalDateTime timestamp;

    public boolean isTerminal() {
        return stage != null && stage.isTerminal();
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorContext {
        private String code;
        private String errorCode;
        private String kind;
        private JobStatus stage;
        private String message;
        private String diagnostic;

        public static ErrorContext from(JobError error) {
            return ErrorContext.builder()
                    .code(error.getErrorCode().getCode())
                    .errorCode(error.getErrorCode().name())
                    .kind(error.getKind() != null ? error.getKind().name() : null)
                    .stage(error.getStage())
                    .message(error.getMessage())
                    .diagnostic(error.getDiagnostic())
                    .build();
        }
    }
}
