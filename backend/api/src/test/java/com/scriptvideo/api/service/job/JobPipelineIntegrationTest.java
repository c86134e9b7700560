package com.scriptvideo.api.service.job;

import com.scriptvideo.api.IntegrationTestSupport;
import com.scriptvideo.api.dto.JobDto;
import com.scriptvideo.api.entity.Asset;
import com.scriptvideo.api.entity.GeneratedVideo;
import com.scriptvideo.api.entity.Job;
import com.scriptvideo.api.entity.ProgressEvent;
import com.scriptvideo.api.service.ai.ModelException;
import com.scriptvideo.api.service.storage.StorageManager;
import com.scriptvideo.common.enums.AssetType;
import com.scriptvideo.common.enums.JobStatus;
import com.scriptvideo.common.enums.ModelErrorKind;
import com.scriptvideo.common.enums.QualityTier;
import com.scriptvideo.common.enums.StorageArea;
import com.scriptvideo.common.exception.ApiException;
import com.scriptvideo.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobPipelineIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private JobDispatcher jobDispatcher;

    @Autowired
    private StorageManager storageManager;

    @Test
    void scriptBecomesComposedVideo() throws Exception {
        when(modelProvider.generateText(eq("text-a"), anyString(), eq(true))).thenReturn(text(scenesJson(3)));
        when(modelProvider.generateImage(eq("image-a"), anyString(), anyString())).thenReturn(image());
        when(modelProvider.synthesizeSpeech(eq("speech-a"), anyString(), anyString())).thenReturn(speech());

        String jobId = jobDispatcher.submit(request(List.of("IMAGE", "AUDIO"), 3)).getJobId();
        Job job = awaitTerminal(jobId);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgressPercentage()).isEqualTo(100);
        assertThat(job.getSceneCount()).isEqualTo(3);
        assertThat(job.resourceUsage().getModelRequestCount()).isEqualTo(7);

        List<Asset> assets = jobStore.listAssets(jobId);
        assertThat(assets).hasSize(6);
        assertThat(assets).allSatisfy(a -> {
            assertThat(Path.of(a.getFilePath())).exists();
            assertThat(a.getModelUsed()).isEqualTo("model-a");
        });
        assertThat(assets).filteredOn(a -> a.getAssetType() == AssetType.AUDIO)
                .extracting(Asset::getModelEndpoint).containsOnly("speech-a");

        GeneratedVideo video = jobStore.findVideoByJob(jobId).orElseThrow();
        assertThat(Path.of(video.getFilePath())).exists();
        assertThat(video.getDurationSeconds()).isEqualTo(30.0);
        assertThat(video.getResolution()).isEqualTo("640x360");
        assertThat(mediaEncoder.tasks()).contains("segment-0", "segment-1", "segment-2", "concat", "mux-audio");
        assertThat(storageManager.jobDirectory(jobId, StorageArea.TEMP)).doesNotExist();

        List<ProgressEvent> events = progressPublisher.replay(jobId, 0);
        assertThat(events.get(0).getStage()).isEqualTo(JobStatus.PENDING);
        assertThat(events).extracting(ProgressEvent::getStage)
                .contains(JobStatus.ANALYZING_SCRIPT, JobStatus.GENERATING_ASSETS, JobStatus.COMPOSING_VIDEO);
        assertGapless(events);
        ProgressEvent last = events.get(events.size() - 1);
        assertThat(last.getStage()).isEqualTo(JobStatus.COMPLETED);
        assertThat(last.getPercentage()).isEqualTo(100);
        assertThat(last.getMetrics()).containsEntry("videoId", video.getVideoId());
    }

    @Test
    void contentPolicyRejectionFailsJobAndRemovesFiles() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        when(modelProvider.generateText(eq("text-a"), anyString(), eq(true))).thenReturn(text(scenesJson(4)));
        when(modelProvider.generateImage(eq("image-a"), anyString(), anyString())).thenAnswer(inv -> {
            if (calls.incrementAndGet() == 2) {
                throw new ModelException(ModelErrorKind.CONTENT_POLICY_REJECTED, "안전 필터에 의해 차단되었습니다: SAFETY",
                        "{\"blockReason\": \"SAFETY\"}");
            }
            return image();
        });

        String jobId = jobDispatcher.submit(request(List.of("IMAGE"), 4)).getJobId();
        Job job = awaitTerminal(jobId);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.error().getStage()).isEqualTo(JobStatus.GENERATING_ASSETS);
        assertThat(job.error().getErrorCode()).isEqualTo(ErrorCode.MODEL_CONTENT_POLICY);
        assertThat(job.error().getKind()).isEqualTo(ModelErrorKind.CONTENT_POLICY_REJECTED);
        assertThat(job.error().getDiagnostic()).contains("SAFETY");
        assertThat(jobStore.findVideoByJob(jobId)).isEmpty();
        assertThat(mediaEncoder.tasks()).isEmpty();
        assertThat(storageManager.jobDirectory(jobId, StorageArea.IMAGES)).doesNotExist();
        assertThat(jobStore.listAssets(jobId)).allSatisfy(a -> assertThat(Path.of(a.getFilePath())).doesNotExist());

        List<ProgressEvent> events = progressPublisher.replay(jobId, 0);
        assertGapless(events);
        ProgressEvent last = events.get(events.size() - 1);
        assertThat(last.getStage()).isEqualTo(JobStatus.FAILED);
        assertThat(last.getErrorContext().getErrorCode()).isEqualTo("MODEL_CONTENT_POLICY");
        assertThat(last.getErrorContext().getStage()).isEqualTo(JobStatus.GENERATING_ASSETS);
    }

    @Test
    void transientAnalysisFailureIsRetried() throws Exception {
        when(modelProvider.generateText(eq("text-a"), anyString(), eq(true)))
                .thenThrow(new ModelException(ModelErrorKind.TIMEOUT, "timeout"))
                .thenReturn(text(scenesJson(1)));
        when(modelProvider.generateImage(eq("image-a"), anyString(), anyString())).thenReturn(image());

        String jobId = jobDispatcher.submit(request(List.of("IMAGE"), 1)).getJobId();
        Job job = awaitTerminal(jobId);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.resourceUsage().getRetryCount()).isEqualTo(1);
        assertThat(mediaEncoder.tasks()).endsWith("finalize");
    }

    @Test
    void compositionFailureKeepsEncoderOutput() throws Exception {
        when(modelProvider.generateText(eq("text-a"), anyString(), eq(true))).thenReturn(text(scenesJson(2)));
        when(modelProvider.generateImage(eq("image-a"), anyString(), anyString())).thenReturn(image());
        mediaEncoder.failOn("concat", "concat.txt: Invalid data found when processing input");

        String jobId = jobDispatcher.submit(request(List.of("IMAGE"), 2)).getJobId();
        Job job = awaitTerminal(jobId);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.error().getStage()).isEqualTo(JobStatus.COMPOSING_VIDEO);
        assertThat(job.error().getErrorCode()).isEqualTo(ErrorCode.VIDEO_FFMPEG_FAILED);
        assertThat(job.error().getDiagnostic()).contains("Invalid data found");
        assertThat(storageManager.jobDirectory(jobId, StorageArea.TEMP)).doesNotExist();
    }

    @Test
    void cancelDuringAssetsStopsAtNextBoundary() throws Exception {
        CountDownLatch firstCallStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        when(modelProvider.generateText(eq("text-a"), anyString(), eq(true))).thenReturn(text(scenesJson(6)));
        when(modelProvider.generateImage(eq("image-a"), anyString(), anyString())).thenAnswer(inv -> {
            calls.incrementAndGet();
            firstCallStarted.countDown();
            release.await(10, TimeUnit.SECONDS);
            return image();
        });

        String jobId = jobDispatcher.submit(request(List.of("IMAGE"), 6)).getJobId();
        assertThat(firstCallStarted.await(10, TimeUnit.SECONDS)).isTrue();

        Job afterCancel = jobDispatcher.cancel(jobId);
        assertThat(afterCancel.getCancelRequested()).isTrue();

        // 진행 중인 호출이 끝나기 전에는 취소로 전이하지 않음
        Thread.sleep(300);
        assertThat(jobStore.get(jobId).getStatus()).isEqualTo(JobStatus.GENERATING_ASSETS);
        assertThat(progressPublisher.replay(jobId, 0))
                .extracting(ProgressEvent::getStage)
                .doesNotContain(JobStatus.CANCELLED);

        release.countDown();
        Job job = awaitTerminal(jobId);

        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(calls.get()).isLessThan(6);
        // 진행 중이던 호출은 모두 끝까지 실행되어 저장됨
        assertThat(jobStore.listAssets(jobId)).hasSize(calls.get());
        assertThat(jobStore.findVideoByJob(jobId)).isEmpty();
        assertThat(mediaEncoder.tasks()).isEmpty();
        assertThat(storageManager.jobDirectory(jobId, StorageArea.IMAGES)).doesNotExist();
        ProgressEvent last = progressPublisher.latest(jobId).orElseThrow();
        assertThat(last.getStage()).isEqualTo(JobStatus.CANCELLED);
        assertGapless(progressPublisher.replay(jobId, 0));

        assertThatThrownBy(() -> jobDispatcher.cancel(jobId))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.JOB_ALREADY_FINISHED);
    }

    @Test
    void queuedJobIsCancelledImmediately() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        when(modelProvider.generateText(eq("text-a"), anyString(), eq(true))).thenAnswer(inv -> {
            bothRunning.countDown();
            release.await(10, TimeUnit.SECONDS);
            return text(scenesJson(1));
        });

        String first = jobDispatcher.submit(request(List.of("IMAGE"), 1)).getJobId();
        String second = jobDispatcher.submit(request(List.of("IMAGE"), 1)).getJobId();
        assertThat(bothRunning.await(10, TimeUnit.SECONDS)).isTrue();
        String queued = jobDispatcher.submit(request(List.of("IMAGE"), 1)).getJobId();

        Job cancelled = jobDispatcher.cancel(queued);

        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(progressPublisher.latest(queued)).get()
                .extracting(ProgressEvent::getStage).isEqualTo(JobStatus.CANCELLED);

        jobDispatcher.cancel(first);
        jobDispatcher.cancel(second);
        release.countDown();
        assertThat(awaitTerminal(first).getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(awaitTerminal(second).getStatus()).isEqualTo(JobStatus.CANCELLED);
        verify(modelProvider, never()).generateImage(anyString(), anyString(), anyString());
    }

    @Test
    void invalidRequestIsRejectedBeforeQueueing() {
        int active = jobDispatcher.activeJobs();

        JobDto.SubmitRequest request = JobDto.SubmitRequest.builder()
                .scriptContent("짧은 이야기")
                .assetTypes(List.of("IMAGE"))
                .model("model-text-only")
                .resolution("640x360")
                .durationSeconds(10)
                .build();

        assertThatThrownBy(() -> jobDispatcher.submit(request))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNSUPPORTED_ASSET_TYPE);
        assertThat(jobDispatcher.activeJobs()).isEqualTo(active);
    }

    @Test
    void leftoverJobsAreFailedOnRecovery() {
        Job stale = jobStore.create(Job.builder()
                .requestedModel("model-a").scriptContent("s").assetTypes("IMAGE")
                .width(640).height(360).durationSeconds(10).qualityTier(QualityTier.DRAFT).includeAudio(false)
                .build());
        jobStore.updateStatus(stale.getJobId(), JobStatus.ANALYZING_SCRIPT, 3, "분석");

        jobDispatcher.recoverInterruptedJobs();

        Job recovered = jobStore.get(stale.getJobId());
        assertThat(recovered.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(recovered.error().getErrorCode()).isEqualTo(ErrorCode.JOB_INTERRUPTED);
        assertThat(recovered.error().getStage()).isEqualTo(JobStatus.ANALYZING_SCRIPT);
    }

    private static void assertGapless(List<ProgressEvent> events) {
        for (int i = 0; i < events.size(); i++) {
            assertThat(events.get(i).getSequenceNumber()).isEqualTo(i + 1L);
            if (i > 0 && !events.get(i).isTerminal()) {
                assertThat(events.get(i).getPercentage()).isGreaterThanOrEqualTo(events.get(i - 1).getPercentage());
            }
        }
    }

    private static JobDto.SubmitRequest request(List<String> types, int scenes) {
        return JobDto.SubmitRequest.builder()
                .scriptContent("작은 항구 마을의 하루를 따라가는 이야기")
                .assetTypes(types)
                .numAssets(scenes)
                .model("model-a")
                .resolution("640x360")
                .durationSeconds(30)
                .quality("draft")
                .build();
    }
}
