package com.scriptvideo.api.dto;

import com.scriptvideo.api.entity.GeneratedVideo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

public class VideoDto {

    /**
     * 생성 영상 정보 (파일 경로 대신 스트리밍 URL)
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VideoResponse {
        private String videoId;
        private String jobId;
        private Double durationSeconds;
        private String resolution;
        private String format;
        private Long fileSizeBytes;
        private String streamUrl;
        private LocalDateTime createdAt;

        public static VideoResponse from(GeneratedVideo video) {
            return VideoResponse.builder()
                    .videoId(video.getVideoId())
                    .jobId(video.getJobId())
                    .durationSeconds(video.getDurationSeconds())
                    .resolution(video.getResolution())
                    .format(video.getFormat())
                    .fileSizeBytes(video.getFileSizeBytes())
                    .streamUrl("/api/videos/" + video.getVideoId() + "/stream")
                    .createdAt(video.getCreatedAt())
                    .build();
        }
    }
}
