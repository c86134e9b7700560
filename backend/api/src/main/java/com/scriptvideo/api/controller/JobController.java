package com.scriptvideo.api.controller;

import com.scriptvideo.api.dto.JobDto;
import com.scriptvideo.api.entity.GeneratedVideo;
import com.scriptvideo.api.entity.Job;
import com.scriptvideo.api.entity.ProgressEvent;
import com.scriptvideo.api.service.job.JobDispatcher;
import com.scriptvideo.api.service.job.JobStore;
import com.scriptvideo.api.service.progress.ProgressPublisher;
import com.scriptvideo.api.service.progress.ProgressStreamService;
import com.scriptvideo.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/jobs")
@Tag(name = "Job", description = "스크립트 → 영상 생성 작업 API")
public class JobController {

    private final JobDispatcher jobDispatcher;
    private final JobStore jobStore;
    private final ProgressPublisher progressPublisher;
    private final ProgressStreamService progressStreamService;

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "작업 제출", description = "스크립트와 합성 설정을 받아 영상 생성 작업을 등록합니다.")
    public ApiResponse<JobDto.SubmitResponse> submit(@Valid @RequestBody JobDto.SubmitRequest request) {
        log.info("[Job] Submit - model: {}, types: {}, duration: {}s, resolution: {}",
                request.getModel(), request.getAssetTypes(), request.getDurationSeconds(), request.getResolution());
        Job job = jobDispatcher.submit(request);
        return ApiResponse.success("작업이 등록되었습니다.", JobDto.SubmitResponse.builder()
                .jobId(job.getJobId())
                .status(job.getStatus())
                .build());
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "작업 조회", description = "작업 상태, 진행률, 에러, 리소스 사용량을 조회합니다.")
    public ApiResponse<JobDto.JobResponse> getJob(@PathVariable String jobId) {
        Job job = jobStore.get(jobId);
        String videoId = jobStore.findVideoByJob(jobId).map(GeneratedVideo::getVideoId).orElse(null);
        return ApiResponse.success(JobDto.JobResponse.from(job, videoId));
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "작업 취소", description = "진행 중인 호출이 끝난 뒤 다음 경계에서 작업을 멈춥니다.")
    public ApiResponse<JobDto.JobResponse> cancel(@PathVariable String jobId) {
        log.info("[Job] Cancel - jobId: {}", jobId);
        Job job = jobDispatcher.cancel(jobId);
        return ApiResponse.success("취소가 요청되었습니다.", JobDto.JobResponse.from(job, null));
    }

    @GetMapping("/{jobId}/assets")
    @Operation(summary = "에셋 목록", description = "작업에서 생성된 에셋을 장면 순서로 조회합니다.")
    public ApiResponse<List<JobDto.AssetResponse>> getAssets(@PathVariable String jobId) {
        jobStore.get(jobId);
        List<JobDto.AssetResponse> assets = jobStore.listAssets(jobId).stream()
                .map(JobDto.AssetResponse::from)
                .toList();
        return ApiResponse.success(assets);
    }

    @GetMapping("/{jobId}/events")
    @Operation(summary = "진행 이벤트 재조회", description = "afterSequence 이후 보관된 진행 이벤트를 순서대로 조회합니다.")
    public ApiResponse<List<ProgressEvent>> getEvents(
            @PathVariable String jobId,
            @RequestParam(defaultValue = "0") long afterSequence) {
        jobStore.get(jobId);
        return ApiResponse.success(progressPublisher.replay(jobId, afterSequence));
    }

    @GetMapping(value = "/{jobId}/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "진행 이벤트 스트림", description = "SSE 로 진행 이벤트를 실시간 수신합니다. 종료 이벤트 후 스트림이 닫힙니다.")
    public SseEmitter streamEvents(
            @PathVariable String jobId,
            @RequestHeader(value = "Last-Event-ID", required = false) Long lastEventId,
            @RequestParam(defaultValue = "0") long afterSequence) {
        Job job = jobStore.get(jobId);
        long after = lastEventId != null ? Math.max(lastEventId, afterSequence) : afterSequence;
        return progressStreamService.open(jobId, after, job.isTerminal());
    }
}
