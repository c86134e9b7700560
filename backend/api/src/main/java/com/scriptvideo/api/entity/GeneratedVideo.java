package com.scriptvideo.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedVideo {
    private String videoId;
    private String jobId;
    private String filePath;
    private Double durationSeconds;
    private String resolution;
    private String format;
    private Long fileSizeBytes;
    private LocalDateTime createdAt;
}
