package com.scriptvideo.api.entity;

import com.scriptvideo.common.enums.StorageArea;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 저장소 영역별 사용량과 보존 정책
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageRecord {
    private StorageArea area;
    private String directory;
    private long totalSizeBytes;
    private long fileCount;
    private RetentionPolicy retentionPolicy;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RetentionPolicy {
        private long maxAgeSeconds;
        private long maxSizeBytes;
        private boolean preserveCompletedVideos;
    }
}
