package com.scriptvideo.api.service.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 주기적 보존 정책 정리 (storage.sweep-enabled=false 면 비활성)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "storage.sweep-enabled", havingValue = "true", matchIfMissing = true)
public class StorageSweepScheduler {

    private final StorageManager storageManager;

    @Scheduled(fixedDelayString = "${storage.sweep-interval:PT1H}", initialDelayString = "${storage.sweep-interval:PT1H}")
    public void sweep() {
        log.debug("[Storage] Scheduled retention sweep");
        try {
            storageManager.enforceQuota();
        } catch (RuntimeException e) {
            log.error("[Storage] Retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
