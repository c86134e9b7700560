package com.scriptvideo.api.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptvideo.api.config.GeminiProperties;
import com.scriptvideo.api.util.Diagnostics;
import com.scriptvideo.common.enums.ModelErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gemini / Veo REST API 기반 ModelProvider
 *
 * - 텍스트, 이미지, 음성: models/{model}:generateContent
 * - 영상 클립: models/{model}:predictLongRunning → operation 폴링 → 다운로드
 * - 인증: x-goog-api-key 헤더
 *
 * 실패 분류:
 * 429 → RATE_LIMITED, 408/504/소켓 타임아웃 → TIMEOUT, 그 외 4xx/5xx/네트워크 → UNAVAILABLE,
 * 안전 필터(blockReason, finishReason, raiMediaFilteredReasons) → CONTENT_POLICY_REJECTED,
 * 파싱 실패/데이터 없음 → MALFORMED_RESPONSE
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeminiModelProvider implements ModelProvider {

    private static final String API_KEY_HEADER = "x-goog-api-key";

    private static final Set<String> SAFETY_FINISH_REASONS = Set.of(
            "SAFETY", "IMAGE_SAFETY", "BLOCKED", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final GeminiProperties properties;

    @Override
    public ModelResponse<String> generateText(String endpoint, String prompt, boolean json) throws ModelException {
        Map<String, Object> body = new HashMap<>();
        body.put("contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));
        if (json) {
            body.put("generationConfig", Map.of("responseMimeType", "application/json"));
        }

        long start = System.currentTimeMillis();
        JsonNode root = post(generateContentUrl(endpoint), body, endpoint);
        JsonNode parts = firstCandidateParts(root, endpoint);

        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            if (part.has("text")) {
                text.append(part.get("text").asText());
            }
        }
        if (text.length() == 0) {
            throw new ModelException(ModelErrorKind.MALFORMED_RESPONSE,
                    "Gemini 응답에 텍스트가 없습니다 (" + endpoint + ")", Diagnostics.forStore(root.toString()));
        }

        return ModelResponse.<String>builder()
                .payload(text.toString())
                .mimeType(json ? "application/json" : "text/plain")
                .endpoint(endpoint)
                .unitsConsumed(root.path("usageMetadata").path("totalTokenCount").asLong(0))
                .responseTimeMs(System.currentTimeMillis() - start)
                .requestCount(1)
                .build();
    }

    @Override
    public ModelResponse<byte[]> generateImage(String endpoint, String prompt, String aspectRatio) throws ModelException {
        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("responseModalities", List.of("IMAGE"));
        generationConfig.put("imageConfig", Map.of("aspectRatio", aspectRatio));

        Map<String, Object> body = new HashMap<>();
        body.put("contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));
        body.put("generationConfig", generationConfig);

        long start = System.currentTimeMillis();
        JsonNode root = post(generateContentUrl(endpoint), body, endpoint);
        InlineData data = extractInlineData(root, endpoint, "image/png");

        return ModelResponse.<byte[]>builder()
                .payload(data.bytes())
                .mimeType(data.mimeType())
                .endpoint(endpoint)
                .unitsConsumed(root.path("usageMetadata").path("totalTokenCount").asLong(0))
                .responseTimeMs(System.currentTimeMillis() - start)
                .requestCount(1)
                .build();
    }

    @Override
    public ModelResponse<byte[]> synthesizeSpeech(String endpoint, String text, String voice) throws ModelException {
        Map<String, Object> speechConfig = Map.of(
                "voiceConfig", Map.of("prebuiltVoiceConfig", Map.of("voiceName", voice)));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("responseModalities", List.of("AUDIO"));
        generationConfig.put("speechConfig", speechConfig);

        Map<String, Object> body = new HashMap<>();
        body.put("contents", List.of(Map.of("parts", List.of(Map.of("text", text)))));
        body.put("generationConfig", generationConfig);

        long start = System.currentTimeMillis();
        JsonNode root = post(generateContentUrl(endpoint), body, endpoint);
        InlineData data = extractInlineData(root, endpoint, "audio/pcm");

        return ModelResponse.<byte[]>builder()
                .payload(data.bytes())
                .mimeType(data.mimeType())
                .endpoint(endpoint)
                .unitsConsumed(root.path("usageMetadata").path("totalTokenCount").asLong(0))
                .responseTimeMs(System.currentTimeMillis() - start)
                .requestCount(1)
                .build();
    }

    @Override
    public ModelResponse<byte[]> generateVideoClip(String endpoint, String prompt, int seconds, String aspectRatio)
            throws ModelException {
        Map<String, Object> parameters = new HashMap<>();
        // Veo 는 16:9, 9:16 만 지원
        parameters.put("aspectRatio", "9:16".equals(aspectRatio) ? "9:16" : "16:9");
        parameters.put("durationSeconds", veoDuration(seconds));
        parameters.put("sampleCount", 1);

        Map<String, Object> body = new HashMap<>();
        body.put("instances", List.of(Map.of("prompt", prompt)));
        body.put("parameters", parameters);

        long start = System.currentTimeMillis();
        String url = properties.getBaseUrl() + "/models/" + endpoint + ":predictLongRunning";
        JsonNode operation = post(url, body, endpoint);

        String operationName = operation.path("name").asText(null);
        if (operationName == null) {
            throw new ModelException(ModelErrorKind.MALFORMED_RESPONSE,
                    "Veo 응답에 operation name 이 없습니다", Diagnostics.forStore(operation.toString()));
        }
        log.info("[Gemini] Veo operation started: {}", operationName);

        int requests = 1;
        long deadline = System.currentTimeMillis() + properties.getVideoPollTimeout().toMillis();
        JsonNode status;
        while (true) {
            sleep(properties.getVideoPollInterval().toMillis());
            status = get(properties.getBaseUrl() + "/" + operationName, endpoint);
            requests++;
            if (status.path("done").asBoolean(false)) {
                break;
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new ModelException(ModelErrorKind.TIMEOUT,
                        "Veo 영상 생성 시간 초과 (" + properties.getVideoPollTimeout().toSeconds() + "초)");
            }
            log.debug("[Gemini] Veo operation still in progress... {}", operationName);
        }

        String videoUri = extractVideoUri(status);
        byte[] video = download(videoUri, endpoint);
        requests++;

        return ModelResponse.<byte[]>builder()
                .payload(video)
                .mimeType("video/mp4")
                .endpoint(endpoint)
                .unitsConsumed(0)
                .responseTimeMs(System.currentTimeMillis() - start)
                .requestCount(requests)
                .mediaSeconds((double) veoDuration(seconds))
                .build();
    }

    // ========== HTTP ==========

    private JsonNode post(String url, Map<String, Object> body, String endpoint) throws ModelException {
        String requestJson;
        try {
            requestJson = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
        HttpHeaders headers = headers();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response = exchange(url, HttpMethod.POST, new HttpEntity<>(requestJson, headers),
                String.class, endpoint);
        return parse(response.getBody(), endpoint);
    }

    private JsonNode get(String url, String endpoint) throws ModelException {
        ResponseEntity<String> response = exchange(url, HttpMethod.GET, new HttpEntity<>(headers()),
                String.class, endpoint);
        return parse(response.getBody(), endpoint);
    }

    private byte[] download(String uri, String endpoint) throws ModelException {
        log.info("[Gemini] Downloading video: {}", uri);
        ResponseEntity<byte[]> response = exchange(uri, HttpMethod.GET, new HttpEntity<>(headers()),
                byte[].class, endpoint);
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            throw new ModelException(ModelErrorKind.MALFORMED_RESPONSE, "Veo 영상 다운로드 결과가 비어 있습니다");
        }
        return body;
    }

    private <T> ResponseEntity<T> exchange(String url, HttpMethod method, HttpEntity<?> entity,
                                           Class<T> type, String endpoint) throws ModelException {
        try {
            return restTemplate.exchange(url, method, entity, type);
        } catch (HttpClientErrorException e) {
            String body = e.getResponseBodyAsString();
            log.error("[Gemini] HTTP 클라이언트 에러 - endpoint: {}, status: {}, body: {}",
                    endpoint, e.getStatusCode(), Diagnostics.forLog(body));
            throw new ModelException(classifyStatus(e.getStatusCode()),
                    "Gemini API 요청 실패: " + e.getStatusCode().value() + " (" + endpoint + ")",
                    Diagnostics.forStore(body), e);
        } catch (HttpServerErrorException e) {
            String body = e.getResponseBodyAsString();
            log.error("[Gemini] HTTP 서버 에러 - endpoint: {}, status: {}", endpoint, e.getStatusCode());
            throw new ModelException(classifyStatus(e.getStatusCode()),
                    "Gemini 서버 오류: " + e.getStatusCode().value() + " (" + endpoint + ")",
                    Diagnostics.forStore(body), e);
        } catch (ResourceAccessException e) {
            boolean timeout = e.getCause() instanceof SocketTimeoutException;
            log.error("[Gemini] 네트워크 에러 - endpoint: {}, timeout: {}, message: {}", endpoint, timeout, e.getMessage());
            throw new ModelException(timeout ? ModelErrorKind.TIMEOUT : ModelErrorKind.UNAVAILABLE,
                    (timeout ? "Gemini 응답 시간 초과" : "Gemini 서버 연결 실패") + " (" + endpoint + ")",
                    e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("[Gemini] 예상치 못한 에러 - endpoint: {}, message: {}", endpoint, e.getMessage());
            throw new ModelException(ModelErrorKind.UNAVAILABLE,
                    "Gemini API 호출 실패 (" + endpoint + ")", e.getMessage(), e);
        }
    }

    static ModelErrorKind classifyStatus(HttpStatusCode status) {
        int code = status.value();
        if (code == 429) {
            return ModelErrorKind.RATE_LIMITED;
        }
        if (code == 408 || code == 504) {
            return ModelErrorKind.TIMEOUT;
        }
        return ModelErrorKind.UNAVAILABLE;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, properties.getApiKey());
        return headers;
    }

    private String generateContentUrl(String endpoint) {
        return properties.getBaseUrl() + "/models/" + endpoint + ":generateContent";
    }

    // ========== 응답 파싱 ==========

    private JsonNode parse(String body, String endpoint) throws ModelException {
        if (body == null || body.isBlank()) {
            throw new ModelException(ModelErrorKind.MALFORMED_RESPONSE, "Gemini 응답이 비어 있습니다 (" + endpoint + ")");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ModelException(ModelErrorKind.MALFORMED_RESPONSE,
                    "Gemini 응답 JSON 파싱 실패 (" + endpoint + ")", Diagnostics.forStore(body), e);
        }
    }

    /**
     * candidates[0].content.parts (안전 필터 차단 여부 먼저 확인)
     */
    private JsonNode firstCandidateParts(JsonNode root, String endpoint) throws ModelException {
        String blockReason = root.path("promptFeedback").path("blockReason").asText(null);
        if (blockReason != null) {
            log.warn("[Gemini] Prompt blocked by safety filter: {} ({})", blockReason, endpoint);
            throw new ModelException(ModelErrorKind.CONTENT_POLICY_REJECTED,
                    "안전 필터에 의해 프롬프트가 차단되었습니다: " + blockReason,
                    Diagnostics.forStore(root.path("promptFeedback").toString()));
        }

        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            throw new ModelException(ModelErrorKind.MALFORMED_RESPONSE,
                    "Gemini 응답에 candidates 가 없습니다 (" + endpoint + ")", Diagnostics.forStore(root.toString()));
        }

        JsonNode candidate = candidates.get(0);
        String finishReason = candidate.path("finishReason").asText("");
        if (SAFETY_FINISH_REASONS.contains(finishReason)) {
            log.warn("[Gemini] Response blocked - finishReason: {} ({})", finishReason, endpoint);
            throw new ModelException(ModelErrorKind.CONTENT_POLICY_REJECTED,
                    "안전 필터에 의해 응답이 차단되었습니다: " + finishReason,
                    Diagnostics.forStore(candidate.path("safetyRatings").toString()));
        }

        JsonNode parts = candidate.path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            throw new ModelException(ModelErrorKind.MALFORMED_RESPONSE,
                    "Gemini 응답에 parts 가 없습니다 (finishReason: " + finishReason + ")",
                    Diagnostics.forStore(root.toString()));
        }
        return parts;
    }

    private InlineData extractInlineData(JsonNode root, String endpoint, String defaultMime) throws ModelException {
        for (JsonNode part : firstCandidateParts(root, endpoint)) {
            JsonNode inlineData = part.path("inlineData");
            if (inlineData.has("data")) {
                try {
                    byte[] bytes = Base64.getDecoder().decode(inlineData.get("data").asText());
                    return new InlineData(bytes, inlineData.path("mimeType").asText(defaultMime));
                } catch (IllegalArgumentException e) {
                    throw new ModelException(ModelErrorKind.MALFORMED_RESPONSE,
                            "inlineData base64 디코딩 실패 (" + endpoint + ")", e.getMessage(), e);
                }
            }
        }
        throw new ModelException(ModelErrorKind.MALFORMED_RESPONSE,
                "Gemini 응답에 inlineData 가 없습니다 (" + endpoint + ")", Diagnostics.forStore(root.toString()));
    }

    /**
     * 완료된 Veo operation 에서 영상 URI 추출
     */
    private String extractVideoUri(JsonNode status) throws ModelException {
        if (status.has("error")) {
            String message = status.path("error").path("message").asText("Unknown error");
            String lower = message.toLowerCase();
            ModelErrorKind kind = lower.contains("safety") || lower.contains("policy")
                    ? ModelErrorKind.CONTENT_POLICY_REJECTED
                    : ModelErrorKind.UNAVAILABLE;
            throw new ModelException(kind, "Veo 영상 생성 실패: " + message,
                    Diagnostics.forStore(status.path("error").toString()));
        }

        JsonNode videoResponse = status.path("response").path("generateVideoResponse");
        JsonNode filtered = videoResponse.path("raiMediaFilteredReasons");
        if (filtered.isArray() && !filtered.isEmpty()) {
            throw new ModelException(ModelErrorKind.CONTENT_POLICY_REJECTED,
                    "Veo content policy violation: " + filtered.get(0).asText(), Diagnostics.forStore(filtered.toString()));
        }

        JsonNode samples = videoResponse.path("generatedSamples");
        if (samples.isArray() && !samples.isEmpty()) {
            String uri = samples.get(0).path("video").path("uri").asText(null);
            if (uri != null && !uri.isBlank()) {
                return uri;
            }
        }

        throw new ModelException(ModelErrorKind.MALFORMED_RESPONSE,
                "Veo 응답에서 영상 URI를 찾을 수 없습니다", Diagnostics.forStore(status.toString()));
    }

    /**
     * Veo 지원 길이 (4, 6, 8초) 중 요청 이상인 가장 짧은 값
     */
    static int veoDuration(int seconds) {
        if (seconds <= 4) {
            return 4;
        }
        if (seconds <= 6) {
            return 6;
        }
        return 8;
    }

    private static void sleep(long millis) throws ModelException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelException(ModelErrorKind.UNAVAILABLE, "Veo 폴링이 중단되었습니다", null, e);
        }
    }

    private record InlineData(byte[] bytes, String mimeType) {}
}
