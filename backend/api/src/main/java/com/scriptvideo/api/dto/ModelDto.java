package com.scriptvideo.api.dto;

import com.scriptvideo.common.enums.AssetType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

public class ModelDto {

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelResponse {
        private String modelId;
        private List<AssetType> supportedAssetTypes;
    }
}
