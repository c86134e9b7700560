package com.scriptvideo.api.service.job;

import com.scriptvideo.api.config.PipelineProperties;
import com.scriptvideo.api.dto.JobDto;
import com.scriptvideo.api.entity.Job;
import com.scriptvideo.api.service.progress.ProgressPublisher;
import com.scriptvideo.common.enums.JobStatus;
import com.scriptvideo.common.exception.ApiException;
import com.scriptvideo.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 작업 디스패처
 *
 * 제출된 작업은 동기 검증 후 저장하고 작업 풀에 올린다.
 * 작업 하나는 워커 스레드 하나가 종료 상태까지 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobDispatcher {

    private final JobRequestValidator validator;
    private final JobStore jobStore;
    private final JobPipeline pipeline;
    private final ProgressPublisher progressPublisher;
    private final PipelineProperties properties;
    @Qualifier("jobExecutor")
    private final ExecutorService jobExecutor;

    // 실행 중이거나 대기 중인 작업의 제어 핸들
    private final Map<String, JobHandle> handles = new ConcurrentHashMap<>();

    /**
     * 작업 제출
     * @throws ApiException 검증 실패 (저장되지 않고 큐에도 들어가지 않음)
     */
    public Job submit(JobDto.SubmitRequest request) {
        Job draft = validator.toJob(request);
        Job job = jobStore.create(draft);
        String jobId = job.getJobId();
        progressPublisher.publish(jobId, JobStatus.PENDING, "작업이 대기열에 등록되었습니다.", 0, Map.of(
                "queuedJobs", handles.size()));

        JobHandle handle = new JobHandle(jobId, properties.getMaxJobDuration());
        handles.put(jobId, handle);
        try {
            jobExecutor.execute(() -> runWorker(handle));
        } catch (RejectedExecutionException e) {
            handles.remove(jobId);
            log.error("[Dispatcher] Job pool rejected job - jobId: {}", jobId, e);
            if (handle.claim()) {
                pipeline.failInterrupted(jobStore.get(jobId));
            }
            throw new ApiException(ErrorCode.INTERNAL_SERVER_ERROR, "작업을 실행 대기열에 넣지 못했습니다.", e);
        }
        log.info("[Dispatcher] Job submitted - jobId: {}, model: {}, types: {}, duration: {}s",
                jobId, job.getRequestedModel(), job.getAssetTypes(), job.getDurationSeconds());
        return job;
    }

    /**
     * 취소 요청 (협조적)
     * 실행 중인 작업은 다음 단계/에셋 경계에서 멈추고, 대기 중인 작업은 바로 취소된다.
     */
    public Job cancel(String jobId) {
        Job job = jobStore.get(jobId);
        if (job.isTerminal()) {
            throw new ApiException(ErrorCode.JOB_ALREADY_FINISHED,
                    "이미 종료된 작업입니다: " + jobId + " (" + job.getStatus() + ")");
        }
        if (!jobStore.requestCancel(jobId)) {
            throw new ApiException(ErrorCode.JOB_ALREADY_FINISHED, "이미 종료된 작업입니다: " + jobId);
        }

        JobHandle handle = handles.get(jobId);
        if (handle != null) {
            handle.requestCancel();
            if (handle.claim()) {
                handles.remove(jobId);
                pipeline.cancelQueued(jobId);
            }
        } else {
            log.warn("[Dispatcher] Cancel requested for job without worker - jobId: {}", jobId);
        }
        log.info("[Dispatcher] Cancel requested - jobId: {}, status: {}", jobId, job.getStatus());
        return jobStore.get(jobId);
    }

    public Optional<JobHandle> handle(String jobId) {
        return Optional.ofNullable(handles.get(jobId));
    }

    public int activeJobs() {
        return handles.size();
    }

    /**
     * 기동 시 이전 프로세스가 남긴 비종료 작업 정리
     * 워커가 없으므로 영원히 멈춰 있지 않도록 FAILED(JOB_INTERRUPTED) 로 전이한다.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedJobs() {
        List<Job> stale = jobStore.findNonTerminal().stream()
                .filter(job -> !handles.containsKey(job.getJobId()))
                .toList();
        if (stale.isEmpty()) {
            return;
        }
        log.warn("[Dispatcher] Recovering {} interrupted jobs", stale.size());
        for (Job job : stale) {
            pipeline.failInterrupted(job);
        }
    }

    private void runWorker(JobHandle handle) {
        try {
            pipeline.run(handle);
        } finally {
            handles.remove(handle.getJobId());
        }
    }
}
