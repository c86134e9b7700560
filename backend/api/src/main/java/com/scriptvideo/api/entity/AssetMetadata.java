package com.scriptvideo.api.entity;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.scriptvideo.common.enums.AssetType;

/**
 * 에셋 유형별 메타데이터
 * 유형마다 고정된 레코드 하나, JSON 에는 "type" 으로 구분해서 저장
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AssetMetadata.Image.class, name = "IMAGE"),
        @JsonSubTypes.Type(value = AssetMetadata.Audio.class, name = "AUDIO"),
        @JsonSubTypes.Type(value = AssetMetadata.VideoClip.class, name = "VIDEO_CLIP"),
        @JsonSubTypes.Type(value = AssetMetadata.TextOverlay.class, name = "TEXT_OVERLAY")
})
public sealed interface AssetMetadata {

    AssetType assetType();

    record Image(Integer width, Integer height, String mimeType) implements AssetMetadata {
        @Override
        public AssetType assetType() {
            return AssetType.IMAGE;
        }
    }

    record Audio(int sampleRate, int channels, String voice) implements AssetMetadata {
        @Override
        public AssetType assetType() {
            return AssetType.AUDIO;
        }
    }

    record VideoClip(Integer width, Integer height, Double seconds) implements AssetMetadata {
        @Override
        public AssetType assetType() {
            return AssetType.VIDEO_CLIP;
        }
    }

    record TextOverlay(String text, int fontSize) implements AssetMetadata {
        @Override
        public AssetType assetType() {
            return AssetType.TEXT_OVERLAY;
        }
    }
}
