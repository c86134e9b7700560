package com.scriptvideo.api.entity;

import com.scriptvideo.common.enums.QualityTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 합성 설정 (해상도, 목표 길이, 품질, 오디오 포함 여부)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompositionSettings {
    private Integer width;
    private Integer height;
    private Integer durationSeconds;
    private QualityTier qualityTier;
    private boolean includeAudio;

    public String resolution() {
        return width + "x" + height;
    }

    /**
     * 가로:세로 비율 (모델 API aspectRatio 파라미터용)
     */
    public String aspectRatio() {
        if (width == null || height == null) {
            return "16:9";
        }
        if (width.equals(height)) {
            return "1:1";
        }
        return width > height ? "16:9" : "9:16";
    }
}
