package com.scriptvideo.api.config;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP 클라이언트 공통 설정
 * - RestTemplate: Connection timeout, Read timeout 설정
 * - ObjectMapper: JSON 직렬화/역직렬화 설정
 */
@Configuration
public class HttpClientConfig {

    @Value("${http.connect-timeout:30s}")
    private Duration connectTimeout;

    // 읽기 타임아웃 초과는 모델 TIMEOUT 으로 분류되어 재시도된다
    @Value("${http.read-timeout:5m}")
    private Duration readTimeout;

    @Bean
    @Primary
    public RestTemplate restTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());

        return new RestTemplate(factory);
    }

    /**
     * ObjectMapper Bean (싱글톤)
     * - 알 수 없는 속성 무시
     * - Java 8 날짜/시간 지원
     * - 이미지/오디오 base64 응답을 위해 문자열 길이 제한 상향
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // 기본값 20MB → 100MB (긴 나레이션 오디오 응답 ~30MB+)
        StreamReadConstraints constraints = StreamReadConstraints.builder()
            .maxStringLength(100_000_000)
            .build();
        mapper.getFactory().setStreamReadConstraints(constraints);

        return mapper;
    }
}
