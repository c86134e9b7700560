package com.scriptvideo.api.config;

import com.scriptvideo.common.enums.StorageArea;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * 저장소 설정 (storage.*)
 * 영역별 보존 정책은 storage.retention.&lt;area&gt; 로 덮어쓴다.
 * 지정하지 않은 항목은 영역 기본값을 그대로 쓴다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    private String basePath = System.getProperty("java.io.tmpdir") + "/scriptvideo";

    /** 디스크 여유 공간이 이보다 작으면 쓰기를 거부 */
    private long minFreeSpaceMb = 512;

    private boolean sweepEnabled = true;

    private Duration sweepInterval = Duration.ofHours(1);

    private Map<String, Retention> retention = new HashMap<>();

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Retention {
        private Duration maxAge;
        private Long maxSizeMb;
        private Boolean preserveCompletedVideos;

        /**
         * 비어 있는 항목을 기본값으로 채운 새 정책
         */
        Retention withDefaults(Retention defaults) {
            return new Retention(
                    maxAge != null ? maxAge : defaults.maxAge,
                    maxSizeMb != null ? maxSizeMb : defaults.maxSizeMb,
                    preserveCompletedVideos != null ? preserveCompletedVideos : defaults.preserveCompletedVideos);
        }
    }

    private static final Map<StorageArea, Retention> DEFAULTS = new EnumMap<>(StorageArea.class);

    static {
        DEFAULTS.put(StorageArea.VIDEOS, new Retention(Duration.ofDays(30), 10_240L, true));
        DEFAULTS.put(StorageArea.IMAGES, new Retention(Duration.ofDays(7), 2_048L, false));
        DEFAULTS.put(StorageArea.AUDIO, new Retention(Duration.ofDays(7), 1_024L, false));
        DEFAULTS.put(StorageArea.CLIPS, new Retention(Duration.ofDays(7), 2_048L, false));
        DEFAULTS.put(StorageArea.TEMP, new Retention(Duration.ofDays(1), 5_120L, false));
        DEFAULTS.put(StorageArea.STOCK, new Retention(Duration.ofDays(365), 1_024L, true));
    }

    /**
     * 영역의 보존 정책 (항목별로 설정값 우선, 없으면 기본값)
     */
    public Retention retentionFor(StorageArea area) {
        Retention defaults = DEFAULTS.get(area);
        Retention configured = retention.get(area.key());
        return configured != null ? configured.withDefaults(defaults) : defaults.withDefaults(defaults);
    }
}
