package com.scriptvideo.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 영상 품질 티어
 * DRAFT: 미리보기용 빠른 인코딩
 * STANDARD: 기본
 * PREMIUM: 고화질, 느린 인코딩
 */
@Getter
@RequiredArgsConstructor
public enum QualityTier {

    DRAFT("draft", "초안", "veryfast", 28),
    STANDARD("standard", "일반", "fast", 23),
    PREMIUM("premium", "프리미엄", "slow", 18);

    private final String code;
    private final String displayName;
    private final String x264Preset;
    private final int crf;

    /**
     * 코드 또는 이름으로 조회 (대소문자 무시)
     * @return 일치하는 티어, 없으면 null
     */
    public static QualityTier fromCode(String value) {
        if (value == null) {
            return null;
        }
        for (QualityTier tier : values()) {
            if (tier.code.equalsIgnoreCase(value) || tier.name().equalsIgnoreCase(value)) {
                return tier;
            }
        }
        return null;
    }
}
