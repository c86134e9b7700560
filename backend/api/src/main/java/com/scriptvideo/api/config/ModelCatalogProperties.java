package com.scriptvideo.api.config;

import com.scriptvideo.common.enums.AssetType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 모델 카탈로그 (ai.models.&lt;id&gt;.*)
 * 요청에 쓰이는 모델 ID 하나가 용도별 실제 엔드포인트 모델명에 고정 매핑된다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ai")
public class ModelCatalogProperties {

    private Map<String, ModelProfile> models = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class ModelProfile {
        private String text;
        private String image;
        private String speech;
        private String video;

        /**
         * 에셋 유형별 엔드포인트 (없으면 null)
         * TEXT_OVERLAY 는 텍스트 엔드포인트로 캡션을 만든다.
         */
        public String endpointFor(AssetType type) {
            return switch (type) {
                case IMAGE -> image;
                case AUDIO -> speech;
                case VIDEO_CLIP -> video;
                case TEXT_OVERLAY -> text;
            };
        }
    }
}
