package com.scriptvideo.api.entity;

import com.scriptvideo.common.enums.AssetType;
import com.scriptvideo.common.enums.JobStatus;
import com.scriptvideo.common.enums.ModelErrorKind;
import com.scriptvideo.common.enums.QualityTier;
import com.scriptvideo.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * 영상 생성 작업
 * 합성 설정, 에러, 리소스 사용량은 컬럼으로 펼쳐서 저장하고 값 객체로 조립해서 꺼낸다.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    private String jobId;
    private JobStatus status;
    private Integer progressPercentage;
    private String currentMessage;
    private String requestedModel;
    private String scriptContent;
    private String scriptRef;
    private String assetTypes;          // 콤마 구분 (IMAGE,AUDIO)
    private Integer numAssets;          // 요청 장면 수 (null 이면 분석 결과를 따름)
    private Integer sceneCount;         // 분석 결과 장면 수

    // 합성 설정
    private Integer width;
    private Integer height;
    private Integer durationSeconds;
    private QualityTier qualityTier;
    private Boolean includeAudio;

    private Boolean cancelRequested;

    // 에러 (FAILED 일 때만)
    private JobStatus errorStage;
    private ErrorCode errorCode;
    private ModelErrorKind errorKind;
    private String errorMessage;
    private String errorDiagnostic;

    // 리소스 사용량
    private Integer modelRequestCount;
    private Long unitsConsumed;
    private Integer retryCount;
    private Long analysisMillis;
    private Long assetMillis;
    private Long composeMillis;

    private Integer version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public List<AssetType> assetTypeList() {
        if (assetTypes == null || assetTypes.isBlank()) {
            return List.of();
        }
        return Arrays.stream(assetTypes.split(","))
                .map(String::trim)
                .map(AssetType::valueOf)
                .toList();
    }

    public CompositionSettings compositionSettings() {
        return CompositionSettings.builder()
                .width(width)
                .height(height)
                .durationSeconds(durationSeconds)
                .qualityTier(qualityTier)
                .includeAudio(Boolean.TRUE.equals(includeAudio))
                .build();
    }

    /**
     * 저장된 에러 (FAILED 가 아니면 null)
     */
    public JobError error() {
        if (errorCode == null) {
            return null;
        }
        return JobError.builder()
                .stage(errorStage)
                .errorCode(errorCode)
                .kind(errorKind)
                .message(errorMessage)
                .diagnostic(errorDiagnostic)
                .build();
    }

    public ResourceUsage resourceUsage() {
        return ResourceUsage.builder()
                .modelRequestCount(nz(modelRequestCount))
                .unitsConsumed(unitsConsumed != null ? unitsConsumed : 0L)
                .retryCount(nz(retryCount))
                .analysisMillis(analysisMillis != null ? analysisMillis : 0L)
                .assetMillis(assetMillis != null ? assetMillis : 0L)
                .composeMillis(composeMillis != null ? composeMillis : 0L)
                .build();
    }

    public long elapsedSeconds() {
        if (startedAt == null) {
            return 0;
        }
        LocalDateTime end = completedAt != null ? completedAt : LocalDateTime.now();
        return Math.max(0, Duration.between(startedAt, end).getSeconds());
    }

    /**
     * 경과 시간과 진행률로 남은 시간 추정 (종료 상태이거나 진행률 0 이면 null)
     */
    public Long estimatedRemainingSeconds() {
        int progress = nz(progressPercentage);
        if (isTerminal() || progress <= 0) {
            return null;
        }
        return elapsedSeconds() * (100 - progress) / progress;
    }

    private static int nz(Integer value) {
        return value != null ? value : 0;
    }
}
