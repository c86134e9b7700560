package com.scriptvideo.api.service.ai;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 모델 호출 결과
 * @param <T> 텍스트(String) 또는 바이너리(byte[])
 */
@Getter
@Builder
@AllArgsConstructor
public class ModelResponse<T> {
    private final T payload;
    private final String mimeType;
    private final String endpoint;      // 실제 호출한 엔드포인트 모델명
    private final long unitsConsumed;   // 토큰 수 (없으면 0)
    private final long responseTimeMs;
    private final int requestCount;     // 폴링 포함 HTTP 요청 수
    private final Double mediaSeconds;  // 실제 생성된 영상 길이 (영상 클립만, 그 외 null)
}
