package com.scriptvideo.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * 저장소 영역 (디렉토리 구조)
 * videos/, assets/images/, assets/audio/, assets/clips/, assets/temp/, stock/
 */
@Getter
@RequiredArgsConstructor
public enum StorageArea {

    VIDEOS("videos"),
    IMAGES("assets/images"),
    AUDIO("assets/audio"),
    CLIPS("assets/clips"),
    TEMP("assets/temp"),
    STOCK("stock");

    private final String relativePath;

    /**
     * 설정 키 (storage.retention.&lt;key&gt;)
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
