package com.scriptvideo.api.service.job;

import com.scriptvideo.api.entity.ResourceUsage;
import com.scriptvideo.api.service.ai.ModelResponse;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 작업 하나의 리소스 사용량 누적 (에셋 생성 스레드에서 동시에 갱신)
 */
public class UsageTracker {

    private final AtomicInteger modelRequests = new AtomicInteger();
    private final AtomicLong unitsConsumed = new AtomicLong();
    private final AtomicInteger retries = new AtomicInteger();
    private final AtomicInteger abandonedCalls = new AtomicInteger();
    private final AtomicLong analysisMillis = new AtomicLong();
    private final AtomicLong assetMillis = new AtomicLong();
    private final AtomicLong composeMillis = new AtomicLong();

    public void record(ModelResponse<?> response) {
        modelRequests.addAndGet(Math.max(1, response.getRequestCount()));
        unitsConsumed.addAndGet(response.getUnitsConsumed());
    }

    /**
     * 재시도 카운터 (RetryPolicy 에 전달)
     */
    public AtomicInteger retries() {
        return retries;
    }

    /**
     * 재시도 없이 또는 재시도 끝에 포기한 호출 수 (마지막 실패 요청도 요청 수에 포함)
     */
    public AtomicInteger abandonedCalls() {
        return abandonedCalls;
    }

    public void addAnalysisMillis(long millis) {
        analysisMillis.addAndGet(millis);
    }

    public void addAssetMillis(long millis) {
        assetMillis.addAndGet(millis);
    }

    public void addComposeMillis(long millis) {
        composeMillis.addAndGet(millis);
    }

    public ResourceUsage snapshot() {
        return ResourceUsage.builder()
                .modelRequestCount(modelRequests.get() + retries.get() + abandonedCalls.get())
                .unitsConsumed(unitsConsumed.get())
                .retryCount(retries.get())
                .analysisMillis(analysisMillis.get())
                .assetMillis(assetMillis.get())
                .composeMillis(composeMillis.get())
                .build();
    }
}
