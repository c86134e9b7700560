package com.scriptvideo.api.service.job;

import com.scriptvideo.api.config.PipelineProperties;
import com.scriptvideo.api.entity.Asset;
import com.scriptvideo.api.entity.CompositionSettings;
import com.scriptvideo.api.entity.GeneratedVideo;
import com.scriptvideo.api.entity.Job;
import com.scriptvideo.api.entity.JobError;
import com.scriptvideo.api.entity.ProgressEvent.ErrorContext;
import com.scriptvideo.api.entity.SceneDescription;
import com.scriptvideo.api.service.ai.AssetGenerator;
import com.scriptvideo.api.service.ai.AssetRequest;
import com.scriptvideo.api.service.ai.ModelException;
import com.scriptvideo.api.service.ai.ScriptAnalyzer;
import com.scriptvideo.api.service.compose.TimelinePlanner;
import com.scriptvideo.api.service.compose.VideoComposer;
import com.scriptvideo.api.service.progress.ProgressPublisher;
import com.scriptvideo.api.service.storage.StorageManager;
import com.scriptvideo.api.util.Diagnostics;
import com.scriptvideo.common.enums.AssetType;
import com.scriptvideo.common.enums.JobStatus;
import com.scriptvideo.common.exception.ConsistencyException;
import com.scriptvideo.common.exception.ErrorCode;
import com.scriptvideo.common.exception.PipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 작업 하나의 단계 실행 (워커 스레드에서 처음부터 끝까지)
 *
 * ANALYZING_SCRIPT → GENERATING_ASSETS → COMPOSING_VIDEO → COMPLETED
 * - 단계 전후로 상태/진행률을 저장한 뒤 진행 이벤트를 발행
 * - 에셋 생성은 공유 풀에 최대 K 개까지 동시에 올리고, 완료 처리는 워커 스레드에서 하나씩
 * - 취소/기한은 단계 경계와 에셋 경계에서만 확인 (진행 중인 호출은 끝날 때까지 기다림)
 * - 실패/취소 시 파일 정리 후 종료 상태 저장, 마지막으로 종료 이벤트 발행
 *
 * 진행률: 분석 0~10, 에셋 10~80, 합성 80~99, 완료 100
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobPipeline {

    static final int ANALYSIS_DONE_PERCENT = 10;
    static final int ASSETS_DONE_PERCENT = 80;
    static final int COMPOSE_DONE_PERCENT = 99;

    private final JobStore jobStore;
    private final ScriptAnalyzer scriptAnalyzer;
    private final AssetGenerator assetGenerator;
    private final VideoComposer videoComposer;
    private final StorageManager storageManager;
    private final ProgressPublisher progressPublisher;
    private final PipelineProperties properties;
    @Qualifier("assetExecutor")
    private final ExecutorService assetExecutor;

    public void run(JobHandle handle) {
        String jobId = handle.getJobId();
        if (!handle.claim()) {
            log.info("[Dispatcher] Job was cancelled while queued - jobId: {}", jobId);
            return;
        }
        handle.start();
        UsageTracker usage = new UsageTracker();
        JobStatus stage = JobStatus.PENDING;

        try {
            Job job = jobStore.get(jobId);
            if (job.isTerminal()) {
                log.warn("[Dispatcher] Job already finished before start - jobId: {}, status: {}", jobId, job.getStatus());
                return;
            }
            if (Boolean.TRUE.equals(job.getCancelRequested())) {
                handle.requestCancel();
            }

            // 1. 스크립트 분석
            handle.checkpoint(stage);
            stage = JobStatus.ANALYZING_SCRIPT;
            advance(jobId, stage, 0, "스크립트 분석을 시작합니다.", Map.of());
            long analysisStart = System.currentTimeMillis();
            List<SceneDescription> scenes;
            try {
                scenes = scriptAnalyzer.analyzeScript(jobId, job.getRequestedModel(), job.getScriptContent(),
                        job.getNumAssets(), job.getDurationSeconds(), usage);
            } finally {
                usage.addAnalysisMillis(System.currentTimeMillis() - analysisStart);
            }
            jobStore.recordSceneCount(jobId, scenes.size());
            advance(jobId, stage, ANALYSIS_DONE_PERCENT, "스크립트 분석 완료: " + scenes.size() + "개 장면",
                    metrics("scenes", scenes.size(), "analysisMillis", usage.snapshot().getAnalysisMillis()));

            // 2. 에셋 생성
            handle.checkpoint(stage);
            stage = JobStatus.GENERATING_ASSETS;
            List<Asset> assets = generateAssets(handle, job, scenes, usage);

            // 3. 합성
            handle.checkpoint(stage);
            stage = JobStatus.COMPOSING_VIDEO;
            CompositionSettings settings = job.compositionSettings();
            advance(jobId, stage, ASSETS_DONE_PERCENT, "영상 합성을 시작합니다.", metrics("assets", assets.size()));
            long composeStart = System.currentTimeMillis();
            GeneratedVideo composed;
            try {
                composed = videoComposer.compose(jobId, assets, settings);
            } finally {
                usage.addComposeMillis(System.currentTimeMillis() - composeStart);
            }
            advance(jobId, stage, COMPOSE_DONE_PERCENT, "영상 합성 완료", metrics(
                    "durationSeconds", composed.getDurationSeconds(), "composeMillis", usage.snapshot().getComposeMillis()));
            handle.checkpoint(stage);

            // 4. 완료
            GeneratedVideo video = jobStore.recordVideo(jobId, composed, usage.snapshot());
            storageManager.cleanup(jobId, JobStatus.COMPLETED);
            progressPublisher.publish(jobId, JobStatus.COMPLETED, "영상 생성이 완료되었습니다.", 100, metrics(
                    "videoId", video.getVideoId(),
                    "durationSeconds", video.getDurationSeconds(),
                    "fileSizeBytes", video.getFileSizeBytes(),
                    "modelRequests", usage.snapshot().getModelRequestCount()));
            log.info("[Dispatcher] Job completed - jobId: {}, videoId: {}, usage: requests={}, retries={}",
                    jobId, video.getVideoId(), usage.snapshot().getModelRequestCount(), usage.snapshot().getRetryCount());

        } catch (JobCancelledException e) {
            finishCancelled(jobId, e.getStage(), usage);
        } catch (PipelineException e) {
            finishFailed(jobId, stage, e, usage);
        } catch (ConsistencyException e) {
            log.error("[Dispatcher] Consistency error - jobId: {}, stage: {}", jobId, stage, e);
            finishFailed(jobId, stage, new PipelineException(e.getErrorCode(), e.getMessage(), e.toString(), e), usage);
        } catch (RuntimeException e) {
            log.error("[Dispatcher] Unexpected error - jobId: {}, stage: {}", jobId, stage, e);
            finishFailed(jobId, stage, new PipelineException(ErrorCode.INTERNAL_SERVER_ERROR,
                    "작업 처리 중 예상치 못한 오류가 발생했습니다.", e.toString(), e), usage);
        }
    }

    /**
     * 장면 × 에셋 유형 만큼 생성하고 저장된 에셋 수가 정확히 N 인지 확인
     */
    List<Asset> generateAssets(JobHandle handle, Job job, List<SceneDescription> scenes, UsageTracker usage)
            throws PipelineException, JobCancelledException {
        String jobId = job.getJobId();
        List<AssetRequest> requests = buildRequests(job, scenes);
        int total = requests.size();
        int concurrency = Math.max(1, properties.getAssetConcurrency());
        advance(jobId, JobStatus.GENERATING_ASSETS, ANALYSIS_DONE_PERCENT,
                "에셋 생성을 시작합니다. (0/" + total + ")", metrics("completedAssets", 0, "totalAssets", total));

        CompletionService<Asset> completionService = new ExecutorCompletionService<>(assetExecutor);
        Map<Future<Asset>, AssetRequest> inFlight = new IdentityHashMap<>();
        Iterator<AssetRequest> pending = requests.iterator();
        PipelineException failure = null;
        boolean cancelled = handle.isCancelRequested();
        int completed = 0;
        long started = System.currentTimeMillis();

        try {
            while (true) {
                while (failure == null && !cancelled && inFlight.size() < concurrency && pending.hasNext()) {
                    AssetRequest request = pending.next();
                    inFlight.put(completionService.submit(() -> assetGenerator.generateAsset(request, usage)), request);
                }
                if (inFlight.isEmpty()) {
                    break;
                }

                Future<Asset> done = completionService.poll(handle.remainingMillis(), TimeUnit.MILLISECONDS);
                if (done == null) {
                    log.warn("[Dispatcher] Deadline reached with {} assets in flight - jobId: {}", inFlight.size(), jobId);
                    inFlight.keySet().forEach(f -> f.cancel(true));
                    throw handle.timeout(JobStatus.GENERATING_ASSETS);
                }
                AssetRequest request = inFlight.remove(done);

                try {
                    Asset asset = jobStore.saveAsset(done.get());
                    completed++;
                    log.debug("[AssetGen] Asset saved - {}, path: {}", request.label(), asset.getFilePath());
                    if (failure == null && !cancelled) {
                        int percent = ANALYSIS_DONE_PERCENT
                                + (ASSETS_DONE_PERCENT - ANALYSIS_DONE_PERCENT) * completed / total;
                        advance(jobId, JobStatus.GENERATING_ASSETS, percent,
                                "에셋 생성 중 (" + completed + "/" + total + ")",
                                metrics("completedAssets", completed, "totalAssets", total,
                                        "sceneIndex", request.getScene().getIndex(),
                                        "assetType", request.getAssetType().name()));
                    }
                } catch (ExecutionException e) {
                    PipelineException cause = asPipelineException(e.getCause(), request);
                    if (failure == null) {
                        failure = cause;
                        log.warn("[AssetGen] Asset failed, stopping fan-out - {}, code: {}, in flight: {}",
                                request.label(), cause.getErrorCode(), inFlight.size());
                    } else {
                        log.warn("[AssetGen] Asset failed after earlier failure - {}, code: {}",
                                request.label(), cause.getErrorCode());
                    }
                }

                if (!cancelled && handle.isCancelRequested()) {
                    cancelled = true;
                    log.info("[Dispatcher] Cancel observed during assets - jobId: {}, waiting for {} in flight",
                            jobId, inFlight.size());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            inFlight.keySet().forEach(f -> f.cancel(true));
            throw new PipelineException(ErrorCode.JOB_INTERRUPTED, "작업 스레드가 중단되었습니다.", e.toString(), e);
        } finally {
            usage.addAssetMillis(System.currentTimeMillis() - started);
        }

        if (failure != null) {
            throw failure;
        }
        if (cancelled) {
            throw new JobCancelledException(jobId, JobStatus.GENERATING_ASSETS);
        }

        int stored = jobStore.countAssets(jobId);
        if (stored != total) {
            throw new PipelineException(ErrorCode.ASSET_COUNT_MISMATCH,
                    "생성된 에셋 수(" + stored + ")가 요청 수(" + total + ")와 다릅니다.",
                    "expected=" + total + ", stored=" + stored);
        }
        advance(jobId, JobStatus.GENERATING_ASSETS, ASSETS_DONE_PERCENT, "에셋 생성 완료 (" + total + "/" + total + ")",
                metrics("completedAssets", total, "totalAssets", total, "assetMillis", usage.snapshot().getAssetMillis()));
        return jobStore.listAssets(jobId);
    }

    List<AssetRequest> buildRequests(Job job, List<SceneDescription> scenes) {
        CompositionSettings settings = job.compositionSettings();
        List<Double> weights = scenes.stream().map(SceneDescription::getDurationWeight).toList();
        List<Long> durations = TimelinePlanner.allocate(weights, settings.getDurationSeconds() * 1000L);

        List<AssetRequest> requests = new ArrayList<>();
        for (int i = 0; i < scenes.size(); i++) {
            for (AssetType type : job.assetTypeList()) {
                requests.add(AssetRequest.builder()
                        .jobId(job.getJobId())
                        .modelId(job.getRequestedModel())
                        .scene(scenes.get(i))
                        .assetType(type)
                        .settings(settings)
                        .sceneDurationMillis(durations.get(i))
                        .build());
            }
        }
        return requests;
    }

    /**
     * 큐에서 대기 중에 취소된 작업 종료 (워커가 집어 들기 전)
     */
    public void cancelQueued(String jobId) {
        finishCancelled(jobId, JobStatus.PENDING, new UsageTracker());
    }

    /**
     * 이전 프로세스에서 끝나지 못한 작업을 FAILED 로 정리 (기동 시)
     */
    public void failInterrupted(Job job) {
        finishFailed(job.getJobId(), job.getStatus(), new PipelineException(ErrorCode.JOB_INTERRUPTED,
                ErrorCode.JOB_INTERRUPTED.getMessage(),
                "status at startup: " + job.getStatus() + ", updatedAt: " + job.getUpdatedAt()), new UsageTracker());
    }

    // ========== 종료 처리 ==========

    private void finishFailed(String jobId, JobStatus stage, PipelineException e, UsageTracker usage) {
        JobError error = JobError.builder()
                .stage(stage)
                .errorCode(e.getErrorCode())
                .kind(e instanceof ModelException me ? me.getKind() : null)
                .message(e.getMessage())
                .diagnostic(Diagnostics.forStore(e.getDiagnostic()))
                .build();
        log.error("[Dispatcher] Job failed - jobId: {}, stage: {}, code: {}, message: {}, diagnostic: {}",
                jobId, stage, e.getErrorCode(), e.getMessage(), Diagnostics.forLog(e.getDiagnostic()));

        storageManager.cleanup(jobId, JobStatus.FAILED);
        int percentage = currentPercentage(jobId);
        try {
            jobStore.markFailed(jobId, error, usage.snapshot());
        } catch (ConsistencyException ce) {
            log.error("[Dispatcher] Could not record failure - jobId: {}", jobId, ce);
            return;
        }
        progressPublisher.publish(jobId, JobStatus.FAILED, e.getMessage(), percentage,
                metrics("modelRequests", usage.snapshot().getModelRequestCount()), ErrorContext.from(error));
    }

    private void finishCancelled(String jobId, JobStatus stage, UsageTracker usage) {
        log.info("[Dispatcher] Job cancelled - jobId: {}, stage: {}", jobId, stage);
        storageManager.cleanup(jobId, JobStatus.CANCELLED);
        int percentage = currentPercentage(jobId);
        try {
            jobStore.markCancelled(jobId, usage.snapshot());
        } catch (ConsistencyException ce) {
            log.error("[Dispatcher] Could not record cancellation - jobId: {}", jobId, ce);
            return;
        }
        progressPublisher.publish(jobId, JobStatus.CANCELLED, "작업이 취소되었습니다. (" + stage.getDescription() + ")",
                percentage, metrics("cancelledAt", stage.name()));
    }

    /**
     * 저장 후 발행 (저장이 실패하면 이벤트도 나가지 않는다)
     */
    private void advance(String jobId, JobStatus stage, int percentage, String message, Map<String, Object> metrics) {
        Job updated = jobStore.updateStatus(jobId, stage, percentage, message);
        progressPublisher.publish(jobId, stage, message, updated.getProgressPercentage(), metrics);
    }

    private int currentPercentage(String jobId) {
        return jobStore.find(jobId)
                .map(Job::getProgressPercentage)
                .orElse(0);
    }

    private static PipelineException asPipelineException(Throwable cause, AssetRequest request) {
        if (cause instanceof PipelineException pe) {
            return pe;
        }
        log.error("[AssetGen] Unexpected error - {}", request.label(), cause);
        return new PipelineException(ErrorCode.INTERNAL_SERVER_ERROR,
                "에셋 생성 중 예상치 못한 오류가 발생했습니다: " + request.label(),
                String.valueOf(cause), cause);
    }

    private static Map<String, Object> metrics(Object... keyValues) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                metrics.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return metrics;
    }
}
