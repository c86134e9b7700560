package com.scriptvideo.api.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 작업 파이프라인 설정 (pipeline.*)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** 동시에 실행되는 작업 수 */
    private int maxConcurrentJobs = 2;

    /** 작업 하나당 동시에 진행되는 에셋 생성 수 (K) */
    private int assetConcurrency = 3;

    /** 작업 최대 실행 시간 */
    private Duration maxJobDuration = Duration.ofMinutes(30);

    private int maxScenes = 12;

    private int maxDurationSeconds = 600;

    /** script_ref 로 참조하는 스크립트 파일 디렉토리 */
    private String scriptDir = "scripts";

    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(30);
    }
}
