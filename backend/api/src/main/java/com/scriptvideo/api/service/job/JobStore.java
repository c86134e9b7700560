package com.scriptvideo.api.service.job;

import com.scriptvideo.api.entity.Asset;
import com.scriptvideo.api.entity.GeneratedVideo;
import com.scriptvideo.api.entity.Job;
import com.scriptvideo.api.entity.JobError;
import com.scriptvideo.api.entity.ResourceUsage;
import com.scriptvideo.api.mapper.AssetMapper;
import com.scriptvideo.api.mapper.GeneratedVideoMapper;
import com.scriptvideo.api.mapper.JobMapper;
import com.scriptvideo.common.enums.JobStatus;
import com.scriptvideo.common.exception.ApiException;
import com.scriptvideo.common.exception.ConsistencyException;
import com.scriptvideo.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * 작업 저장소
 *
 * 상태 전이는 모두 낙관적 잠금(version)으로 갱신한다.
 * - 전이는 JobStatus 상태 머신으로 검증, 위반 시 ConsistencyException
 * - 진행률은 종료 전까지 감소하지 않음 (작은 값이 들어오면 기존 값 유지)
 * - GeneratedVideo 는 COMPLETED 전이와 같은 트랜잭션에서 한 번만 기록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    private static final int MAX_UPDATE_ATTEMPTS = 5;

    private final JobMapper jobMapper;
    private final AssetMapper assetMapper;
    private final GeneratedVideoMapper generatedVideoMapper;

    public Job create(Job job) {
        LocalDateTime now = LocalDateTime.now();
        Job toInsert = job.toBuilder()
                .jobId(job.getJobId() != null ? job.getJobId() : UUID.randomUUID().toString())
                .status(JobStatus.PENDING)
                .progressPercentage(0)
                .currentMessage(JobStatus.PENDING.getDescription())
                .cancelRequested(false)
                .version(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobMapper.insert(toInsert);
        log.info("[JobStore] Job created - jobId: {}, model: {}, types: {}",
                toInsert.getJobId(), toInsert.getRequestedModel(), toInsert.getAssetTypes());
        return get(toInsert.getJobId());
    }

    public Optional<Job> find(String jobId) {
        return jobMapper.findById(jobId);
    }

    public Job get(String jobId) {
        return jobMapper.findById(jobId)
                .orElseThrow(() -> new ApiException(ErrorCode.JOB_NOT_FOUND, "작업을 찾을 수 없습니다: " + jobId));
    }

    public List<Job> findNonTerminal() {
        List<JobStatus> statuses = Arrays.stream(JobStatus.values())
                .filter(s -> !s.isTerminal())
                .toList();
        return jobMapper.findByStatuses(statuses);
    }

    /**
     * 상태/진행률 갱신
     * 같은 상태를 다시 넘기면 진행률과 메시지만 갱신한다.
     */
    public Job updateStatus(String jobId, JobStatus next, int percentage, String message) {
        return mutate(jobId, current -> {
            requireTransition(current, next);
            LocalDateTime now = LocalDateTime.now();
            Job.JobBuilder builder = current.toBuilder()
                    .status(next)
                    .progressPercentage(next == JobStatus.COMPLETED
                            ? 100
                            : Math.max(current.getProgressPercentage(), clamp(percentage)))
                    .currentMessage(message);
            if (current.getStartedAt() == null && next != JobStatus.PENDING) {
                builder.startedAt(now);
            }
            if (next.isTerminal()) {
                builder.completedAt(now);
            }
            return builder.build();
        });
    }

    /**
     * FAILED 전이 + 에러 기록
     */
    public Job markFailed(String jobId, JobError error, ResourceUsage usage) {
        return mutate(jobId, current -> {
            requireTransition(current, JobStatus.FAILED);
            LocalDateTime now = LocalDateTime.now();
            return withUsage(current.toBuilder(), usage)
                    .status(JobStatus.FAILED)
                    .currentMessage(error.getMessage())
                    .errorStage(error.getStage())
                    .errorCode(error.getErrorCode())
                    .errorKind(error.getKind())
                    .errorMessage(error.getMessage())
                    .errorDiagnostic(error.getDiagnostic())
                    .startedAt(current.getStartedAt() != null ? current.getStartedAt() : now)
                    .completedAt(now)
                    .build();
        });
    }

    public Job markCancelled(String jobId, ResourceUsage usage) {
        return mutate(jobId, current -> {
            requireTransition(current, JobStatus.CANCELLED);
            LocalDateTime now = LocalDateTime.now();
            return withUsage(current.toBuilder(), usage)
                    .status(JobStatus.CANCELLED)
                    .currentMessage(JobStatus.CANCELLED.getDescription())
                    .startedAt(current.getStartedAt() != null ? current.getStartedAt() : now)
                    .completedAt(now)
                    .build();
        });
    }

    public Job recordSceneCount(String jobId, int sceneCount) {
        return mutate(jobId, current -> current.toBuilder().sceneCount(sceneCount).build());
    }

    public Job recordUsage(String jobId, ResourceUsage usage) {
        return mutate(jobId, current -> withUsage(current.toBuilder(), usage).build());
    }

    /**
     * 취소 요청 플래그 저장
     * @return 종료 상태가 아니어서 플래그가 기록되었으면 true
     */
    public boolean requestCancel(String jobId) {
        return jobMapper.markCancelRequested(jobId) > 0;
    }

    public Asset saveAsset(Asset asset) {
        Asset toInsert = asset.toBuilder()
                .assetId(asset.getAssetId() != null ? asset.getAssetId() : UUID.randomUUID().toString())
                .createdAt(LocalDateTime.now())
                .build();
        assetMapper.insert(toInsert);
        return toInsert;
    }

    public List<Asset> listAssets(String jobId) {
        return assetMapper.findByJobId(jobId);
    }

    public int countAssets(String jobId) {
        return assetMapper.countByJobId(jobId);
    }

    /**
     * COMPLETED 전이와 GeneratedVideo 기록을 한 트랜잭션으로 처리
     */
    @Transactional
    public GeneratedVideo recordVideo(String jobId, GeneratedVideo video, ResourceUsage usage) {
        if (generatedVideoMapper.findByJobId(jobId).isPresent()) {
            throw new ConsistencyException(ErrorCode.ILLEGAL_STATE_TRANSITION,
                    "Generated video already recorded for job " + jobId);
        }
        Job completed = mutate(jobId, current -> {
            requireTransition(current, JobStatus.COMPLETED);
            LocalDateTime now = LocalDateTime.now();
            return withUsage(current.toBuilder(), usage)
                    .status(JobStatus.COMPLETED)
                    .progressPercentage(100)
                    .currentMessage(JobStatus.COMPLETED.getDescription())
                    .completedAt(now)
                    .build();
        });
        GeneratedVideo toInsert = GeneratedVideo.builder()
                .videoId(video.getVideoId() != null ? video.getVideoId() : UUID.randomUUID().toString())
                .jobId(jobId)
                .filePath(video.getFilePath())
                .durationSeconds(video.getDurationSeconds())
                .resolution(video.getResolution())
                .format(video.getFormat())
                .fileSizeBytes(video.getFileSizeBytes())
                .createdAt(completed.getCompletedAt())
                .build();
        generatedVideoMapper.insert(toInsert);
        log.info("[JobStore] Video recorded - jobId: {}, videoId: {}", jobId, toInsert.getVideoId());
        return toInsert;
    }

    public Optional<GeneratedVideo> findVideo(String videoId) {
        return generatedVideoMapper.findById(videoId);
    }

    public Optional<GeneratedVideo> findVideoByJob(String jobId) {
        return generatedVideoMapper.findByJobId(jobId);
    }

    /**
     * 읽기 → 변경 → version 조건부 갱신, 충돌 시 다시 읽어서 재시도
     */
    private Job mutate(String jobId, UnaryOperator<Job> change) {
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            Job current = get(jobId);
            Job updated = change.apply(current).toBuilder()
                    .jobId(jobId)
                    .version(current.getVersion())
                    .updatedAt(LocalDateTime.now())
                    .build();
            if (jobMapper.updateWithVersion(updated) == 1) {
                return updated.toBuilder().version(current.getVersion() + 1).build();
            }
            log.debug("[JobStore] Version conflict - jobId: {}, attempt: {}", jobId, attempt);
        }
        throw new ConsistencyException(ErrorCode.CONCURRENT_MODIFICATION,
                "Job " + jobId + " was modified concurrently " + MAX_UPDATE_ATTEMPTS + " times");
    }

    private static void requireTransition(Job current, JobStatus next) {
        JobStatus from = current.getStatus();
        if (from == next && !from.isTerminal()) {
            return;
        }
        if (!from.canTransitionTo(next)) {
            throw new ConsistencyException(ErrorCode.ILLEGAL_STATE_TRANSITION,
                    "Illegal transition " + from + " -> " + next + " for job " + current.getJobId());
        }
    }

    private static Job.JobBuilder withUsage(Job.JobBuilder builder, ResourceUsage usage) {
        if (usage == null) {
            return builder;
        }
        return builder
                .modelRequestCount(usage.getModelRequestCount())
                .unitsConsumed(usage.getUnitsConsumed())
                .retryCount(usage.getRetryCount())
                .analysisMillis(usage.getAnalysisMillis())
                .assetMillis(usage.getAssetMillis())
                .composeMillis(usage.getComposeMillis());
    }

    private static int clamp(int percentage) {
        return Math.max(0, Math.min(100, percentage));
    }
}
