package com.scriptvideo.api.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptvideo.api.config.PipelineProperties;
import com.scriptvideo.api.entity.SceneDescription;
import com.scriptvideo.api.service.job.UsageTracker;
import com.scriptvideo.api.util.Diagnostics;
import com.scriptvideo.common.enums.ModelErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 스크립트 → 장면 목록
 * 모델 응답이 기대한 구조가 아니면 기본 분할로 대체하지 않고 MALFORMED_RESPONSE 로 실패한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScriptAnalyzer {

    private static final String PROMPT_TEMPLATE = """
            You are a video storyboard editor. Split the following script into %s scenes for a %d-second video.
            Return JSON only, in this exact shape:
            {"scenes": [{"theme": "...", "visual": "...", "narration": "...", "durationWeight": 1.0}]}
            - theme: one short phrase describing the scene
            - visual: a concrete visual description usable as an image or video generation prompt
            - narration: the exact passage of the script spoken during this scene
            - durationWeight: positive number, relative screen time of the scene
            Keep the scenes in script order and cover the whole script.

            SCRIPT:
            %s
            """;

    private final ModelProvider modelProvider;
    private final ModelCatalog modelCatalog;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    /**
     * @param numAssets 요청 장면 수 (null 이면 모델이 결정, 최대 max-scenes)
     */
    public List<SceneDescription> analyzeScript(String jobId, String modelId, String script, Integer numAssets,
                                                int durationSeconds, UsageTracker usage) throws ModelException {
        String endpoint = modelCatalog.textEndpoint(modelId);
        String sceneCount = numAssets != null
                ? "exactly " + numAssets
                : "between 1 and " + properties.getMaxScenes();
        String prompt = String.format(PROMPT_TEMPLATE, sceneCount, durationSeconds, script);

        log.info("[AssetGen] Analyzing script - jobId: {}, model: {}, endpoint: {}, length: {}",
                jobId, modelId, endpoint, script.length());
        ModelResponse<String> response = retryPolicy.execute("analyze:" + jobId,
                () -> modelProvider.generateText(endpoint, prompt, true),
                usage.retries(), usage.abandonedCalls());
        usage.record(response);

        List<SceneDescription> scenes = parseScenes(response.getPayload(), numAssets);
        log.info("[AssetGen] Script analyzed - jobId: {}, scenes: {}, {}ms",
                jobId, scenes.size(), response.getResponseTimeMs());
        return scenes;
    }

    List<SceneDescription> parseScenes(String raw, Integer expectedCount) throws ModelException {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(raw));
        } catch (JsonProcessingException e) {
            throw malformed("장면 JSON 파싱 실패", raw, e);
        }

        JsonNode sceneNodes = root != null && root.isArray() ? root : root != null ? root.path("scenes") : null;
        if (sceneNodes == null || !sceneNodes.isArray() || sceneNodes.isEmpty()) {
            throw malformed("응답에 장면 목록이 없습니다", raw, null);
        }
        if (expectedCount != null && sceneNodes.size() != expectedCount) {
            throw malformed("장면 수가 요청과 다릅니다 (요청 " + expectedCount + ", 응답 " + sceneNodes.size() + ")",
                    raw, null);
        }
        if (sceneNodes.size() > properties.getMaxScenes()) {
            throw malformed("장면 수가 최대치를 초과했습니다 (" + sceneNodes.size() + " > "
                    + properties.getMaxScenes() + ")", raw, null);
        }

        List<SceneDescription> scenes = new ArrayList<>();
        for (int i = 0; i < sceneNodes.size(); i++) {
            JsonNode node = sceneNodes.get(i);
            String theme = text(node, "theme");
            String visual = text(node, "visual");
            String narration = text(node, "narration");
            double weight = weight(node);
            if (theme == null || visual == null || narration == null) {
                throw malformed("장면 " + (i + 1) + " 에 필수 항목(theme, visual, narration)이 없습니다", raw, null);
            }
            if (!(weight > 0) || Double.isInfinite(weight)) {
                throw malformed("장면 " + (i + 1) + " 의 durationWeight 가 양수가 아닙니다", raw, null);
            }
            scenes.add(SceneDescription.builder()
                    .index(i)
                    .theme(theme)
                    .visual(visual)
                    .narration(narration)
                    .durationWeight(weight)
                    .build());
        }
        return scenes;
    }

    /**
     * ```json ... ``` 코드 블록 제거
     */
    static String stripCodeFence(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : text.substring(3);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        return text.trim();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private static double weight(JsonNode node) {
        for (String field : new String[]{"durationWeight", "duration_weight", "weight"}) {
            JsonNode value = node.get(field);
            if (value != null && value.isNumber()) {
                return value.asDouble();
            }
        }
        return Double.NaN;
    }

    private static ModelException malformed(String message, String raw, Throwable cause) {
        return new ModelException(ModelErrorKind.MALFORMED_RESPONSE, message, Diagnostics.forStore(raw), cause);
    }
}
