package com.scriptvideo.api.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Gemini / Veo API 설정 (ai.gemini.*)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ai.gemini")
public class GeminiProperties {

    private String apiKey;

    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";

    // Veo 작업 폴링 (10초 간격, 최대 5분)
    private Duration videoPollInterval = Duration.ofSeconds(10);
    private Duration videoPollTimeout = Duration.ofMinutes(5);

    private String ttsVoice = "Kore";
}
