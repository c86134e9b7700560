package com.scriptvideo.api.service.ai;

import com.scriptvideo.api.entity.CompositionSettings;
import com.scriptvideo.api.entity.SceneDescription;
import com.scriptvideo.common.enums.AssetType;
import lombok.Builder;
import lombok.Getter;

/**
 * 에셋 하나 생성 요청 (장면 × 에셋 유형)
 */
@Getter
@Builder
public class AssetRequest {
    private final String jobId;
    private final String modelId;
    private final SceneDescription scene;
    private final AssetType assetType;
    private final CompositionSettings settings;
    private final long sceneDurationMillis;

    public String label() {
        return jobId + "/scene-" + scene.getIndex() + "/" + assetType.name();
    }
}
