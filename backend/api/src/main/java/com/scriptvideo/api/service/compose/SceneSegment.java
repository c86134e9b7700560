package com.scriptvideo.api.service.compose;

import com.scriptvideo.api.entity.Asset;
import com.scriptvideo.common.enums.AssetType;
import lombok.Builder;
import lombok.Getter;

/**
 * 합성 단위 장면 (화면 에셋 + 선택적 나레이션/캡션 + 표시 시간)
 */
@Getter
@Builder
public class SceneSegment {
    private final int sceneIndex;
    private final Asset visual;
    private final Asset audio;
    private final Asset overlay;
    private final long durationMillis;

    public boolean isClip() {
        return visual.getAssetType() == AssetType.VIDEO_CLIP;
    }

    public double durationSeconds() {
        return durationMillis / 1000.0;
    }
}
