package com.scriptvideo.api.service.ai;

import com.scriptvideo.api.config.PipelineProperties;
import com.scriptvideo.common.enums.ModelErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 일시적 모델 오류(TIMEOUT, RATE_LIMITED) 재시도
 * 지수 백오프: base, base*2, base*4 ... (max 로 상한), 최대 maxRetries 회
 */
@Slf4j
@Component
public class RetryPolicy {

    @FunctionalInterface
    public interface ModelCall<T> {
        T call() throws ModelException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    @Autowired
    public RetryPolicy(PipelineProperties properties) {
        this(properties.getRetry().getMaxRetries(), properties.getRetry().getBaseDelay(),
                properties.getRetry().getMaxDelay(), d -> Thread.sleep(d.toMillis()));
    }

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, Sleeper sleeper) {
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.sleeper = sleeper;
    }

    /**
     * @param label 로그용 호출 이름
     * @param retries 재시도 횟수 누적 카운터
     * @param abandoned 결국 실패로 끝난 호출 수 누적 카운터
     */
    public <T> T execute(String label, ModelCall<T> call, AtomicInteger retries, AtomicInteger abandoned)
            throws ModelException {
        int attempt = 0;
        while (true) {
            try {
                return call.call();
            } catch (ModelException e) {
                if (!e.isRetryable() || attempt >= maxRetries) {
                    abandoned.incrementAndGet();
                    throw e;
                }
                Duration delay = delayFor(attempt);
                attempt++;
                retries.incrementAndGet();
                log.warn("[AssetGen] {} failed ({}), retry {}/{} after {}ms",
                        label, e.getKind(), attempt, maxRetries, delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ModelException(ModelErrorKind.UNAVAILABLE, label + " 재시도 대기 중 중단되었습니다", null, ie);
                }
            }
        }
    }

    /**
     * n번째 재시도 전 대기 시간 (0부터)
     */
    public Duration delayFor(int attempt) {
        long millis = baseDelay.toMillis() << Math.min(attempt, 20);
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
