package com.scriptvideo.api.service.ai;

import com.scriptvideo.api.config.GeminiProperties;
import com.scriptvideo.api.entity.Asset;
import com.scriptvideo.api.entity.AssetMetadata;
import com.scriptvideo.api.entity.CompositionSettings;
import com.scriptvideo.api.entity.SceneDescription;
import com.scriptvideo.api.service.job.UsageTracker;
import com.scriptvideo.api.service.storage.StorageException;
import com.scriptvideo.api.service.storage.StorageManager;
import com.scriptvideo.api.util.AudioUtils;
import com.scriptvideo.common.exception.ErrorCode;
import com.scriptvideo.common.exception.PipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * 장면별 에셋 생성
 * 요청 모델의 고정 엔드포인트만 사용하고, 결과 파일은 StorageManager 를 통해 원자적으로 기록한다.
 * 반환한 Asset 은 아직 저장되지 않은 상태 (작업 워커가 순서대로 기록)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssetGenerator {

    static final int CAPTION_MAX_LENGTH = 60;
    static final int CAPTION_FONT_SIZE = 48;

    private final ModelProvider modelProvider;
    private final ModelCatalog modelCatalog;
    private final RetryPolicy retryPolicy;
    private final StorageManager storageManager;
    private final GeminiProperties geminiProperties;

    public Asset generateAsset(AssetRequest request, UsageTracker usage) throws PipelineException {
        String endpoint = modelCatalog.endpointFor(request.getModelId(), request.getAssetType());
        log.info("[AssetGen] Generating {} - endpoint: {}", request.label(), endpoint);

        Asset asset = switch (request.getAssetType()) {
            case IMAGE -> generateImage(request, endpoint, usage);
            case AUDIO -> generateAudio(request, endpoint, usage);
            case VIDEO_CLIP -> generateClip(request, endpoint, usage);
            case TEXT_OVERLAY -> generateOverlay(request, endpoint, usage);
        };

        log.info("[AssetGen] Generated {} - {}ms, file: {}",
                request.label(), asset.getModelResponseTimeMs(), asset.getFilePath());
        return asset;
    }

    private Asset generateImage(AssetRequest request, String endpoint, UsageTracker usage) throws PipelineException {
        CompositionSettings settings = request.getSettings();
        String prompt = imagePrompt(request.getScene(), settings);

        ModelResponse<byte[]> response = retryPolicy.execute(request.label(),
                () -> modelProvider.generateImage(endpoint, prompt, settings.aspectRatio()),
                usage.retries(), usage.abandonedCalls());
        usage.record(response);

        String extension = "image/jpeg".equals(response.getMimeType()) ? "jpg" : "png";
        Path file = write(request, extension, response.getPayload());

        BufferedImage image = readImage(response.getPayload());
        AssetMetadata metadata = new AssetMetadata.Image(
                image != null ? image.getWidth() : null,
                image != null ? image.getHeight() : null,
                response.getMimeType());
        return baseAsset(request, endpoint, prompt, response, file)
                .metadata(metadata)
                .build();
    }

    private Asset generateAudio(AssetRequest request, String endpoint, UsageTracker usage) throws PipelineException {
        String text = request.getScene().getNarration();
        String voice = geminiProperties.getTtsVoice();

        ModelResponse<byte[]> response = retryPolicy.execute(request.label(),
                () -> modelProvider.synthesizeSpeech(endpoint, text, voice),
                usage.retries(), usage.abandonedCalls());
        usage.record(response);

        byte[] pcm = response.getPayload();
        byte[] wav;
        try {
            wav = AudioUtils.pcmToWav(pcm, AudioUtils.TTS_SAMPLE_RATE, AudioUtils.TTS_CHANNELS);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_IO_FAILED, "WAV 변환 실패: " + request.label(), e);
        }
        Path file = write(request, "wav", wav);

        double seconds = AudioUtils.pcmDurationSeconds(pcm.length, AudioUtils.TTS_SAMPLE_RATE, AudioUtils.TTS_CHANNELS);
        return baseAsset(request, endpoint, text, response, file)
                .durationSeconds(seconds)
                .metadata(new AssetMetadata.Audio(AudioUtils.TTS_SAMPLE_RATE, AudioUtils.TTS_CHANNELS, voice))
                .build();
    }

    private Asset generateClip(AssetRequest request, String endpoint, UsageTracker usage) throws PipelineException {
        CompositionSettings settings = request.getSettings();
        String prompt = clipPrompt(request.getScene());
        int seconds = (int) Math.max(1, Math.ceil(request.getSceneDurationMillis() / 1000.0));

        ModelResponse<byte[]> response = retryPolicy.execute(request.label(),
                () -> modelProvider.generateVideoClip(endpoint, prompt, seconds, settings.aspectRatio()),
                usage.retries(), usage.abandonedCalls());
        usage.record(response);

        Path file = write(request, "mp4", response.getPayload());
        // 모델이 지원하는 길이로 올림되어 생성되므로 응답의 실제 길이를 기록
        double produced = response.getMediaSeconds() != null ? response.getMediaSeconds() : seconds;
        return baseAsset(request, endpoint, prompt, response, file)
                .durationSeconds(produced)
                .metadata(new AssetMetadata.VideoClip(settings.getWidth(), settings.getHeight(), produced))
                .build();
    }

    private Asset generateOverlay(AssetRequest request, String endpoint, UsageTracker usage) throws PipelineException {
        String prompt = captionPrompt(request.getScene());

        ModelResponse<String> response = retryPolicy.execute(request.label(),
                () -> modelProvider.generateText(endpoint, prompt, false),
                usage.retries(), usage.abandonedCalls());
        usage.record(response);

        String caption = normalizeCaption(response.getPayload());
        Path file = write(request, "txt", caption.getBytes(StandardCharsets.UTF_8));
        return baseAsset(request, endpoint, prompt, response, file)
                .metadata(new AssetMetadata.TextOverlay(caption, CAPTION_FONT_SIZE))
                .build();
    }

    // ========== 프롬프트 ==========

    static String imagePrompt(SceneDescription scene, CompositionSettings settings) {
        return "Create a single cinematic still image for a video scene.\n"
                + "Scene theme: " + scene.getTheme() + "\n"
                + "Visual: " + scene.getVisual() + "\n"
                + "Aspect ratio " + settings.aspectRatio() + ". No text, letters or watermarks in the image.";
    }

    static String clipPrompt(SceneDescription scene) {
        return scene.getVisual() + " (" + scene.getTheme() + "). Smooth camera movement, no on-screen text.";
    }

    static String captionPrompt(SceneDescription scene) {
        return "Write one short on-screen caption (at most 8 words) for this video scene. "
                + "Return the caption text only, without quotes.\n"
                + "Theme: " + scene.getTheme() + "\n"
                + "Narration: " + scene.getNarration();
    }

    /**
     * 한 줄, 따옴표 제거, 최대 길이 제한
     */
    static String normalizeCaption(String raw) {
        String caption = raw == null ? "" : raw.strip();
        int newline = caption.indexOf('\n');
        if (newline >= 0) {
            caption = caption.substring(0, newline).strip();
        }
        if (caption.length() >= 2 && (caption.startsWith("\"") && caption.endsWith("\""))) {
            caption = caption.substring(1, caption.length() - 1).strip();
        }
        if (caption.length() > CAPTION_MAX_LENGTH) {
            caption = caption.substring(0, CAPTION_MAX_LENGTH).strip();
        }
        return caption;
    }

    // ========== 공통 ==========

    private Path write(AssetRequest request, String extension, byte[] data) throws StorageException {
        Path target = storageManager.allocate(request.getJobId(), request.getAssetType().getStorageArea(), extension);
        return storageManager.writeAtomically(target, data);
    }

    private static Asset.AssetBuilder baseAsset(AssetRequest request, String endpoint, String prompt,
                                                ModelResponse<?> response, Path file) {
        return Asset.builder()
                .jobId(request.getJobId())
                .sceneIndex(request.getScene().getIndex())
                .assetType(request.getAssetType())
                .filePath(file.toString())
                .durationWeight(request.getScene().getDurationWeight())
                .generationPrompt(prompt)
                .modelUsed(request.getModelId())
                .modelEndpoint(endpoint)
                .modelResponseTimeMs(response.getResponseTimeMs());
    }

    private static BufferedImage readImage(byte[] bytes) {
        try {
            return ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            log.debug("[AssetGen] Could not read image dimensions: {}", e.getMessage());
            return null;
        }
    }
}
