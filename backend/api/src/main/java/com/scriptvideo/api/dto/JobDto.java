package com.scriptvideo.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.scriptvideo.api.entity.Asset;
import com.scriptvideo.api.entity.AssetMetadata;
import com.scriptvideo.api.entity.Job;
import com.scriptvideo.api.entity.JobError;
import com.scriptvideo.api.entity.ResourceUsage;
import com.scriptvideo.common.enums.AssetType;
import com.scriptvideo.common.enums.JobStatus;
import com.scriptvideo.common.enums.QualityTier;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

public class JobDto {

    /**
     * 작업 제출 요청 (script_content / script_ref 중 하나만)
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SubmitRequest {
        @JsonAlias("script_content")
        private String scriptContent;

        @JsonAlias("script_ref")
        private String scriptRef;           // scripts 디렉토리 기준 상대 경로

        @NotEmpty
        @JsonAlias("asset_types")
        private List<String> assetTypes;    // IMAGE, AUDIO, VIDEO_CLIP, TEXT_OVERLAY

        @JsonAlias("num_assets")
        private Integer numAssets;          // 장면 수 (생략 시 분석 결과를 따름)

        @NotBlank
        private String model;

        @NotBlank
        private String resolution;          // 1280x720

        @NotNull
        @Positive
        @JsonAlias("duration_seconds")
        private Integer durationSeconds;

        private String quality;             // draft / standard / premium (기본 standard)

        @JsonAlias("include_audio")
        private Boolean includeAudio;       // 기본: AUDIO 에셋을 요청했으면 true
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SubmitResponse {
        private String jobId;
        private JobStatus status;
    }

    /**
     * 작업 상태 조회 응답
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class JobResponse {
        private String jobId;
        private JobStatus status;
        private String statusDescription;
        private int progressPercentage;
        private String currentMessage;
        private String requestedModel;
        private List<AssetType> assetTypes;
        private Integer numAssets;
        private Integer sceneCount;
        private Settings compositionSettings;
        private boolean cancelRequested;
        private ErrorInfo error;
        private ResourceUsage resourceUsage;
        private Long elapsedSeconds;
        private Long estimatedRemainingSeconds;
        private String videoId;
        private LocalDateTime createdAt;
        private LocalDateTime startedAt;
        private LocalDateTime completedAt;

        public static JobResponse from(Job job, String videoId) {
            return JobResponse.builder()
                    .jobId(job.getJobId())
                    .status(job.getStatus())
                    .statusDescription(job.getStatus().getDescription())
                    .progressPercentage(job.getProgressPercentage() != null ? job.getProgressPercentage() : 0)
                    .currentMessage(job.getCurrentMessage())
                    .requestedModel(job.getRequestedModel())
                    .assetTypes(job.assetTypeList())
                    .numAssets(job.getNumAssets())
                    .sceneCount(job.getSceneCount())
                    .compositionSettings(Settings.builder()
                            .resolution(job.compositionSettings().resolution())
                            .durationSeconds(job.getDurationSeconds())
                            .quality(job.getQualityTier())
                            .includeAudio(Boolean.TRUE.equals(job.getIncludeAudio()))
                            .build())
                    .cancelRequested(Boolean.TRUE.equals(job.getCancelRequested()))
                    .error(ErrorInfo.from(job.error()))
                    .resourceUsage(job.resourceUsage())
                    .elapsedSeconds(job.elapsedSeconds())
                    .estimatedRemainingSeconds(job.estimatedRemainingSeconds())
                    .videoId(videoId)
                    .createdAt(job.getCreatedAt())
                    .startedAt(job.getStartedAt())
                    .completedAt(job.getCompletedAt())
                    .build();
        }
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Settings {
        private String resolution;
        private Integer durationSeconds;
        private QualityTier quality;
        private boolean includeAudio;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorInfo {
        private JobStatus stage;
        private String code;
        private String errorCode;
        private String kind;
        private String message;
        private String diagnostic;

        public static ErrorInfo from(JobError error) {
            if (error == null) {
                return null;
            }
            return ErrorInfo.builder()
                    .stage(error.getStage())
                    .code(error.getErrorCode().getCode())
                    .errorCode(error.getErrorCode().name())
                    .kind(error.getKind() != null ? error.getKind().name() : null)
                    .message(error.getMessage())
                    .diagnostic(error.getDiagnostic())
                    .build();
        }
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AssetResponse {
        private String assetId;
        private Integer sceneIndex;
        private AssetType assetType;
        private String filePath;
        private Double durationSeconds;
        private String generationPrompt;
        private String modelUsed;
        private Long modelResponseTimeMs;
        private Double confidenceScore;
        private AssetMetadata metadata;
        private LocalDateTime createdAt;

        public static AssetResponse from(Asset asset) {
            return AssetResponse.builder()
                    .assetId(asset.getAssetId())
                    .sceneIndex(asset.getSceneIndex())
                    .assetType(asset.getAssetType())
                    .filePath(asset.getFilePath())
                    .durationSeconds(asset.getDurationSeconds())
                    .generationPrompt(asset.getGenerationPrompt())
                    .modelUsed(asset.getModelUsed())
                    .modelResponseTimeMs(asset.getModelResponseTimeMs())
                    .confidenceScore(asset.getConfidenceScore())
                    .metadata(asset.getMetadata())
                    .createdAt(asset.getCreatedAt())
                    .build();
        }
    }
}
