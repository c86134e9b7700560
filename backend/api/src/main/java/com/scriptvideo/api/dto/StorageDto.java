package com.scriptvideo.api.dto;

import com.scriptvideo.api.entity.StorageRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

public class StorageDto {

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UsageResponse {
        private String basePath;
        private List<StorageRecord> areas;
        private Map<String, Long> diskSpace;    // totalBytes, usableBytes
    }
}
