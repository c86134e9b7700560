package com.scriptvideo.api.entity;

import com.scriptvideo.common.enums.AssetType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 생성된 에셋 (기록 후 변경하지 않음, 재생성은 새 레코드)
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Asset {
    private String assetId;
    private String jobId;
    private Integer sceneIndex;
    private AssetType assetType;
    private String filePath;
    private Double durationSeconds;     // 정지 이미지는 null
    private Double durationWeight;      // 장면 길이 가중치 (분석 결과)
    private String generationPrompt;    // 모델에 실제로 보낸 입력
    private String modelUsed;           // 요청 모델 ID 그대로
    private String modelEndpoint;       // 실제 호출한 엔드포인트 모델명
    private Long modelResponseTimeMs;
    private Double confidenceScore;
    private AssetMetadata metadata;
    private LocalDateTime createdAt;
}
