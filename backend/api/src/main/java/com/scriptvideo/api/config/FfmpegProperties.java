package com.scriptvideo.api.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * FFmpeg 인코더 설정 (ffmpeg.*)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ffmpeg")
public class FfmpegProperties {

    private String binary = "ffmpeg";
    private String probeBinary = "ffprobe";
    private Duration timeout = Duration.ofMinutes(30);
    private int fps = 30;

    /** 장면 페이드 인/아웃 최대 길이 (초) */
    private double transitionSeconds = 0.5;

    /** 합성 결과 길이 허용 오차 (초) */
    private double durationToleranceSeconds = 1.0;

    private String fontFile;
}
