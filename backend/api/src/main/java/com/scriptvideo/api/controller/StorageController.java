package com.scriptvideo.api.controller;

import com.scriptvideo.api.dto.StorageDto;
import com.scriptvideo.api.service.storage.StorageManager;
import com.scriptvideo.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/storage")
@Tag(name = "Storage", description = "저장소 사용량 API")
public class StorageController {

    private final StorageManager storageManager;

    @GetMapping("/usage")
    @Operation(summary = "저장소 사용량", description = "영역별 파일 수, 용량, 보존 정책과 디스크 여유 공간을 조회합니다.")
    public ApiResponse<StorageDto.UsageResponse> usage() {
        return ApiResponse.success(StorageDto.UsageResponse.builder()
                .basePath(storageManager.getBasePath().toString())
                .areas(storageManager.scanUsage())
                .diskSpace(storageManager.diskSpace())
                .build());
    }
}
