package com.scriptvideo.api.service.ai;

import com.scriptvideo.api.config.ModelCatalogProperties;
import com.scriptvideo.api.config.ModelCatalogProperties.ModelProfile;
import com.scriptvideo.common.enums.AssetType;
import com.scriptvideo.common.exception.ApiException;
import com.scriptvideo.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 요청 모델 ID → 고정 엔드포인트 조회
 * 지원하지 않는 모델/에셋 유형은 다른 모델로 대체하지 않고 거부한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelCatalog {

    private final ModelCatalogProperties properties;

    public boolean contains(String modelId) {
        return modelId != null && properties.getModels().containsKey(modelId);
    }

    public ModelProfile profile(String modelId) {
        ModelProfile profile = modelId != null ? properties.getModels().get(modelId) : null;
        if (profile == null) {
            throw new ApiException(ErrorCode.UNKNOWN_MODEL, "알 수 없는 모델입니다: " + modelId);
        }
        return profile;
    }

    /**
     * 스크립트 분석용 텍스트 엔드포인트
     */
    public String textEndpoint(String modelId) {
        String endpoint = profile(modelId).getText();
        if (endpoint == null || endpoint.isBlank()) {
            throw new ApiException(ErrorCode.UNSUPPORTED_ASSET_TYPE,
                    "모델 " + modelId + " 에 텍스트 엔드포인트가 없어 스크립트를 분석할 수 없습니다.");
        }
        return endpoint;
    }

    public String endpointFor(String modelId, AssetType type) {
        String endpoint = profile(modelId).endpointFor(type);
        if (endpoint == null || endpoint.isBlank()) {
            throw new ApiException(ErrorCode.UNSUPPORTED_ASSET_TYPE,
                    "모델 " + modelId + " 은(는) " + type.name() + " 에셋을 지원하지 않습니다.");
        }
        return endpoint;
    }

    /**
     * 요청한 에셋 유형 중 모델이 지원하지 않는 것
     */
    public List<AssetType> unsupportedTypes(String modelId, Collection<AssetType> types) {
        ModelProfile profile = profile(modelId);
        List<AssetType> unsupported = new ArrayList<>();
        for (AssetType type : types) {
            String endpoint = profile.endpointFor(type);
            if (endpoint == null || endpoint.isBlank()) {
                unsupported.add(type);
            }
        }
        return unsupported;
    }

    public Map<String, ModelProfile> all() {
        return properties.getModels();
    }
}
