package com.scriptvideo.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 생성 에셋 유형
 */
@Getter
@RequiredArgsConstructor
public enum AssetType {

    IMAGE("이미지", true, StorageArea.IMAGES),
    AUDIO("나레이션 오디오", false, StorageArea.AUDIO),
    VIDEO_CLIP("영상 클립", true, StorageArea.CLIPS),
    TEXT_OVERLAY("텍스트 오버레이", false, StorageArea.TEMP);

    private final String displayName;
    private final boolean visual;          // 장면의 화면(배경)으로 쓸 수 있는지
    private final StorageArea storageArea; // 파일이 저장되는 영역
}
