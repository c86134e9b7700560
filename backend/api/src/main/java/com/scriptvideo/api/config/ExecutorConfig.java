package com.scriptvideo.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 작업 실행 스레드 풀
 * - jobExecutor: 작업 하나당 워커 스레드 하나 (동시 작업 수 제한, 초과분은 큐에서 PENDING 으로 대기)
 * - assetExecutor: 에셋 생성 호출용 공유 풀 (작업별 동시 호출 수는 워커가 K 로 제한)
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService jobExecutor(PipelineProperties properties) {
        int size = Math.max(1, properties.getMaxConcurrentJobs());
        log.info("[Dispatcher] Job pool size: {}", size);
        return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), namedThreads("job-worker-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService assetExecutor(PipelineProperties properties) {
        int size = Math.max(1, properties.getMaxConcurrentJobs() * properties.getAssetConcurrency());
        log.info("[Dispatcher] Asset pool size: {}", size);
        return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), namedThreads("asset-gen-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
