package com.scriptvideo.api.service.job;

import com.scriptvideo.common.enums.JobStatus;
import com.scriptvideo.common.exception.ErrorCode;
import com.scriptvideo.common.exception.PipelineException;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실행 중인 작업 하나의 제어 상태
 * 취소 플래그와 실행 기한을 워커와 디스패처가 공유한다.
 */
public class JobHandle {

    @Getter
    private final String jobId;
    private final Duration maxDuration;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private volatile Instant deadline;

    public JobHandle(String jobId, Duration maxDuration) {
        this.jobId = jobId;
        this.maxDuration = maxDuration;
    }

    /**
     * 작업을 처리할 쪽을 한 번만 정한다.
     * 워커가 이기면 실행, 대기 중 취소가 이기면 워커는 아무것도 하지 않는다.
     */
    public boolean claim() {
        return claimed.compareAndSet(false, true);
    }

    /**
     * 워커가 작업을 집어 든 시점부터 기한을 잰다 (큐 대기 시간 제외)
     */
    public void start() {
        deadline = Instant.now().plus(maxDuration);
    }

    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public long remainingMillis() {
        Instant end = deadline;
        if (end == null) {
            return maxDuration.toMillis();
        }
        return Math.max(0, Duration.between(Instant.now(), end).toMillis());
    }

    /**
     * 단계/에셋 경계 확인: 취소 요청 또는 기한 초과 시 예외
     */
    public void checkpoint(JobStatus stage) throws JobCancelledException, PipelineException {
        if (cancelRequested.get()) {
            throw new JobCancelledException(jobId, stage);
        }
        if (deadline != null && remainingMillis() == 0) {
            throw timeout(stage);
        }
    }

    public PipelineException timeout(JobStatus stage) {
        return new PipelineException(ErrorCode.JOB_TIMEOUT,
                "작업 최대 실행 시간(" + maxDuration.toMinutes() + "분)을 초과했습니다.",
                "deadline exceeded at " + stage);
    }
}
