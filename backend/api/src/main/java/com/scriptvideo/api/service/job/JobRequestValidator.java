package com.scriptvideo.api.service.job;

import com.scriptvideo.api.config.PipelineProperties;
import com.scriptvideo.api.dto.JobDto;
import com.scriptvideo.api.entity.Job;
import com.scriptvideo.api.service.ai.ModelCatalog;
import com.scriptvideo.common.enums.AssetType;
import com.scriptvideo.common.enums.QualityTier;
import com.scriptvideo.common.exception.ApiException;
import com.scriptvideo.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 작업 제출 요청 검증 (동기)
 * 실패한 요청은 큐에 들어가지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobRequestValidator {

    private static final Pattern RESOLUTION = Pattern.compile("^(\\d{2,5})x(\\d{2,5})$");
    static final int MIN_DIMENSION = 64;
    static final int MAX_DIMENSION = 4096;

    private final ModelCatalog modelCatalog;
    private final PipelineProperties properties;

    /**
     * 요청을 검증하고 저장할 작업 초안을 만든다.
     * @throws ApiException 검증 실패 (실패 항목이 하나면 해당 코드, 여러 개면 VALIDATION_FAILED)
     */
    public Job toJob(JobDto.SubmitRequest request) {
        Violations violations = new Violations();

        String model = request.getModel();
        boolean modelKnown = modelCatalog.contains(model);
        if (!modelKnown) {
            violations.add(ErrorCode.UNKNOWN_MODEL, "model: 알 수 없는 모델입니다 (" + model + ")");
        }

        Set<AssetType> types = parseAssetTypes(request.getAssetTypes(), violations);
        if (modelKnown && !types.isEmpty()) {
            List<AssetType> unsupported = modelCatalog.unsupportedTypes(model, types);
            if (!unsupported.isEmpty()) {
                violations.add(ErrorCode.UNSUPPORTED_ASSET_TYPE,
                        "asset_types: 모델 " + model + " 은(는) 지원하지 않습니다 " + unsupported);
            }
            String textEndpoint = modelCatalog.profile(model).getText();
            if (textEndpoint == null || textEndpoint.isBlank()) {
                violations.add(ErrorCode.UNSUPPORTED_ASSET_TYPE,
                        "model: 스크립트 분석용 텍스트 엔드포인트가 없습니다 (" + model + ")");
            }
        }

        Integer duration = request.getDurationSeconds();
        if (duration == null || duration <= 0) {
            violations.add(ErrorCode.VALIDATION_FAILED, "duration_seconds: 0보다 커야 합니다");
        } else if (duration > properties.getMaxDurationSeconds()) {
            violations.add(ErrorCode.VALIDATION_FAILED,
                    "duration_seconds: 최대 " + properties.getMaxDurationSeconds() + "초까지 가능합니다");
        }

        int[] size = parseResolution(request.getResolution(), violations);

        QualityTier tier = QualityTier.STANDARD;
        if (request.getQuality() != null && !request.getQuality().isBlank()) {
            tier = QualityTier.fromCode(request.getQuality());
            if (tier == null) {
                violations.add(ErrorCode.VALIDATION_FAILED, "quality: draft, standard, premium 중 하나여야 합니다");
            }
        }

        Integer numAssets = request.getNumAssets();
        if (numAssets != null && (numAssets < 1 || numAssets > properties.getMaxScenes())) {
            violations.add(ErrorCode.VALIDATION_FAILED,
                    "num_assets: 1 ~ " + properties.getMaxScenes() + " 사이여야 합니다");
        }
        if (numAssets != null && duration != null && duration > 0 && numAssets > duration * 2) {
            violations.add(ErrorCode.VALIDATION_FAILED, "num_assets: 장면당 최소 0.5초가 필요합니다");
        }

        boolean includeAudio = request.getIncludeAudio() != null
                ? request.getIncludeAudio()
                : types.contains(AssetType.AUDIO);
        if (includeAudio && !types.isEmpty() && !types.contains(AssetType.AUDIO)) {
            violations.add(ErrorCode.VALIDATION_FAILED, "include_audio: AUDIO 에셋을 함께 요청해야 합니다");
        }

        String script = resolveScript(request, violations);

        violations.throwIfAny();

        return Job.builder()
                .requestedModel(model)
                .scriptContent(script)
                .scriptRef(blankToNull(request.getScriptRef()))
                .assetTypes(types.stream().map(Enum::name).collect(Collectors.joining(",")))
                .numAssets(numAssets)
                .width(size[0])
                .height(size[1])
                .durationSeconds(duration)
                .qualityTier(tier)
                .includeAudio(includeAudio)
                .build();
    }

    private Set<AssetType> parseAssetTypes(List<String> values, Violations violations) {
        Set<AssetType> types = new LinkedHashSet<>();
        if (values == null || values.isEmpty()) {
            violations.add(ErrorCode.VALIDATION_FAILED, "asset_types: 하나 이상 지정해야 합니다");
            return types;
        }
        for (String value : values) {
            try {
                types.add(AssetType.valueOf(value.trim().toUpperCase()));
            } catch (IllegalArgumentException | NullPointerException e) {
                violations.add(ErrorCode.VALIDATION_FAILED, "asset_types: 알 수 없는 유형입니다 (" + value + ")");
            }
        }
        if (!types.isEmpty() && types.stream().noneMatch(AssetType::isVisual)) {
            violations.add(ErrorCode.VALIDATION_FAILED, "asset_types: IMAGE 또는 VIDEO_CLIP 이 하나 이상 필요합니다");
        }
        return types;
    }

    private int[] parseResolution(String resolution, Violations violations) {
        Matcher matcher = resolution != null ? RESOLUTION.matcher(resolution.trim()) : null;
        if (matcher == null || !matcher.matches()) {
            violations.add(ErrorCode.VALIDATION_FAILED, "resolution: <가로>x<세로> 형식이어야 합니다 (예: 1280x720)");
            return new int[]{0, 0};
        }
        int width = Integer.parseInt(matcher.group(1));
        int height = Integer.parseInt(matcher.group(2));
        if (width < MIN_DIMENSION || height < MIN_DIMENSION || width > MAX_DIMENSION || height > MAX_DIMENSION) {
            violations.add(ErrorCode.VALIDATION_FAILED,
                    "resolution: 각 변은 " + MIN_DIMENSION + " ~ " + MAX_DIMENSION + " 사이여야 합니다");
        }
        // libx264 yuv420p 는 짝수 크기만 허용
        if (width % 2 != 0 || height % 2 != 0) {
            violations.add(ErrorCode.VALIDATION_FAILED, "resolution: 가로/세로는 짝수여야 합니다");
        }
        return new int[]{width, height};
    }

    private String resolveScript(JobDto.SubmitRequest request, Violations violations) {
        String content = blankToNull(request.getScriptContent());
        String ref = blankToNull(request.getScriptRef());
        if ((content == null) == (ref == null)) {
            violations.add(ErrorCode.VALIDATION_FAILED, "script: script_content 와 script_ref 중 하나만 지정해야 합니다");
            return null;
        }
        if (content != null) {
            return content;
        }

        Path root = Paths.get(properties.getScriptDir()).toAbsolutePath().normalize();
        Path file = root.resolve(ref).normalize();
        if (!file.startsWith(root)) {
            violations.add(ErrorCode.VALIDATION_FAILED, "script_ref: 스크립트 디렉토리 밖을 가리킬 수 없습니다");
            return null;
        }
        if (!Files.isRegularFile(file)) {
            violations.add(ErrorCode.SCRIPT_NOT_FOUND, "script_ref: 스크립트를 찾을 수 없습니다 (" + ref + ")");
            return null;
        }
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            if (text.isBlank()) {
                violations.add(ErrorCode.VALIDATION_FAILED, "script_ref: 스크립트가 비어 있습니다 (" + ref + ")");
                return null;
            }
            return text;
        } catch (IOException e) {
            log.warn("[Dispatcher] Failed to read script {}: {}", file, e.getMessage());
            violations.add(ErrorCode.SCRIPT_NOT_FOUND, "script_ref: 스크립트를 읽을 수 없습니다 (" + ref + ")");
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static final class Violations {
        private final List<ErrorCode> codes = new ArrayList<>();
        private final List<String> messages = new ArrayList<>();

        void add(ErrorCode code, String message) {
            codes.add(code);
            messages.add(message);
        }

        void throwIfAny() {
            if (messages.isEmpty()) {
                return;
            }
            ErrorCode code = codes.size() == 1 ? codes.get(0) : ErrorCode.VALIDATION_FAILED;
            String summary = codes.size() == 1 ? messages.get(0) : ErrorCode.VALIDATION_FAILED.getMessage();
            throw new ApiException(code, summary, messages);
        }
    }
}
