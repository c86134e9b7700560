package com.scriptvideo.api.controller;

import com.scriptvideo.api.dto.ModelDto;
import com.scriptvideo.api.service.ai.ModelCatalog;
import com.scriptvideo.common.dto.ApiResponse;
import com.scriptvideo.common.enums.AssetType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/models")
@Tag(name = "Model", description = "사용 가능한 모델 API")
public class ModelController {

    private final ModelCatalog modelCatalog;

    @GetMapping
    @Operation(summary = "모델 목록", description = "요청에 쓸 수 있는 모델 ID 와 지원 에셋 유형을 조회합니다.")
    public ApiResponse<List<ModelDto.ModelResponse>> models() {
        List<ModelDto.ModelResponse> models = modelCatalog.all().entrySet().stream()
                .map(entry -> ModelDto.ModelResponse.builder()
                        .modelId(entry.getKey())
                        .supportedAssetTypes(Arrays.stream(AssetType.values())
                                .filter(type -> {
                                    String endpoint = entry.getValue().endpointFor(type);
                                    return endpoint != null && !endpoint.isBlank();
                                })
                                .toList())
                        .build())
                .sorted((a, b) -> a.getModelId().compareTo(b.getModelId()))
                .toList();
        return ApiResponse.success(models);
    }
}
