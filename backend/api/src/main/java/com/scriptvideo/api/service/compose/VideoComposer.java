package com.scriptvideo.api.service.compose;

import com.scriptvideo.api.config.FfmpegProperties;
import com.scriptvideo.api.entity.Asset;
import com.scriptvideo.api.entity.CompositionSettings;
import com.scriptvideo.api.entity.GeneratedVideo;
import com.scriptvideo.api.service.storage.StorageException;
import com.scriptvideo.api.service.storage.StorageManager;
import com.scriptvideo.common.enums.AssetType;
import com.scriptvideo.common.enums.QualityTier;
import com.scriptvideo.common.enums.StorageArea;
import com.scriptvideo.common.exception.ErrorCode;
import com.scriptvideo.common.exception.PipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 장면 에셋 → 최종 MP4
 *
 * 1. 장면별 세그먼트 (이미지 반복/클립 반복 후 자르기, 해상도 맞춤, 페이드 인/아웃, 캡션)
 * 2. concat demuxer 로 이어붙이기
 * 3. 나레이션 트랙 (장면 길이에 맞춰 패딩/자르기 후 연결, 없는 장면은 무음) AAC 로 합치기
 * 4. ffprobe 로 길이 검증 후 videos/ 로 원자적 이동
 *
 * 작업 하나의 합성은 호출 스레드에서 순차 실행된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VideoComposer {

    private static final int AUDIO_SAMPLE_RATE = 44100;

    private final MediaEncoder mediaEncoder;
    private final StorageManager storageManager;
    private final FfmpegProperties properties;

    public GeneratedVideo compose(String jobId, List<Asset> assets, CompositionSettings settings)
            throws PipelineException {
        List<SceneSegment> segments = planScenes(assets, settings);
        log.info("[Composer] Composing - jobId: {}, scenes: {}, target: {}s, tier: {}, audio: {}",
                jobId, segments.size(), settings.getDurationSeconds(), settings.getQualityTier(),
                settings.isIncludeAudio());

        Path workDir = storageManager.jobDirectory(jobId, StorageArea.TEMP).resolve("compose");
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_IO_FAILED, "합성 작업 디렉토리 생성 실패", e);
        }

        List<Path> segmentFiles = new ArrayList<>();
        for (SceneSegment segment : segments) {
            Path out = workDir.resolve(String.format("segment-%03d.mp4", segment.getSceneIndex()));
            mediaEncoder.encode(segmentArgs(segment, settings, out), "segment-" + segment.getSceneIndex());
            segmentFiles.add(out);
        }

        Path concatList = workDir.resolve("concat.txt");
        writeConcatList(concatList, segmentFiles);
        Path concatenated = workDir.resolve("concat.mp4");
        mediaEncoder.encode(concatArgs(concatList, concatenated), "concat");

        Path finalTemp = workDir.resolve("final.mp4");
        boolean withAudio = settings.isIncludeAudio() && segments.stream().anyMatch(s -> s.getAudio() != null);
        if (withAudio) {
            mediaEncoder.encode(muxArgs(concatenated, segments, settings, finalTemp), "mux-audio");
        } else {
            mediaEncoder.encode(List.of("-i", concatenated.toString(), "-c", "copy", "-an",
                    "-t", seconds(settings.getDurationSeconds() * 1000L),
                    "-movflags", "+faststart", finalTemp.toString()), "finalize");
        }

        double actual = mediaEncoder.probeDuration(finalTemp);
        double target = settings.getDurationSeconds();
        if (Math.abs(actual - target) > properties.getDurationToleranceSeconds()) {
            throw new CompositionException(ErrorCode.VIDEO_DURATION_MISMATCH,
                    String.format(Locale.ROOT, "합성 결과 길이 %.2fs 가 목표 %ds 와 다릅니다 (허용 오차 %.2fs)",
                            actual, settings.getDurationSeconds(), properties.getDurationToleranceSeconds()),
                    "probed=" + actual + ", target=" + target);
        }

        Path finalPath = storageManager.allocate(jobId, StorageArea.VIDEOS, "mp4");
        storageManager.moveAtomically(finalTemp, finalPath);
        long size = fileSize(finalPath);

        log.info("[Composer] Composed - jobId: {}, duration: {}s, size: {} bytes, path: {}",
                jobId, actual, size, finalPath);
        return GeneratedVideo.builder()
                .jobId(jobId)
                .filePath(finalPath.toString())
                .durationSeconds(actual)
                .resolution(settings.resolution())
                .format("mp4")
                .fileSizeBytes(size)
                .build();
    }

    /**
     * 에셋을 장면 순서로 묶고 가중치로 표시 시간 배분
     */
    public List<SceneSegment> planScenes(List<Asset> assets, CompositionSettings settings)
            throws CompositionException {
        Map<Integer, List<Asset>> byScene = new TreeMap<>();
        for (Asset asset : assets) {
            byScene.computeIfAbsent(asset.getSceneIndex(), k -> new ArrayList<>()).add(asset);
        }
        if (byScene.isEmpty()) {
            throw new CompositionException(ErrorCode.VIDEO_COMPOSITION_NO_SCENES, "합성할 장면이 없습니다.");
        }

        List<Double> weights = new ArrayList<>();
        for (Map.Entry<Integer, List<Asset>> entry : byScene.entrySet()) {
            Double weight = entry.getValue().get(0).getDurationWeight();
            weights.add(weight != null && weight > 0 ? weight : 1.0);
        }
        List<Long> durations = TimelinePlanner.allocate(weights, settings.getDurationSeconds() * 1000L);

        List<SceneSegment> segments = new ArrayList<>();
        int i = 0;
        for (Map.Entry<Integer, List<Asset>> entry : byScene.entrySet()) {
            Asset image = find(entry.getValue(), AssetType.IMAGE);
            Asset clip = find(entry.getValue(), AssetType.VIDEO_CLIP);
            Asset visual = clip != null ? clip : image;
            if (visual == null) {
                throw new CompositionException(ErrorCode.VIDEO_COMPOSITION_FAILED,
                        "장면 " + entry.getKey() + " 에 화면 에셋(IMAGE/VIDEO_CLIP)이 없습니다.");
            }
            segments.add(SceneSegment.builder()
                    .sceneIndex(entry.getKey())
                    .visual(visual)
                    .audio(find(entry.getValue(), AssetType.AUDIO))
                    .overlay(find(entry.getValue(), AssetType.TEXT_OVERLAY))
                    .durationMillis(durations.get(i++))
                    .build());
        }
        return segments;
    }

    // ========== FFmpeg 인자 ==========

    List<String> segmentArgs(SceneSegment segment, CompositionSettings settings, Path out) {
        QualityTier tier = settings.getQualityTier() != null ? settings.getQualityTier() : QualityTier.STANDARD;
        String duration = seconds(segment.getDurationMillis());

        List<String> args = new ArrayList<>();
        if (segment.isClip()) {
            args.addAll(List.of("-stream_loop", "-1"));
        } else {
            args.addAll(List.of("-loop", "1", "-framerate", String.valueOf(properties.getFps())));
        }
        args.addAll(List.of("-t", duration, "-i", segment.getVisual().getFilePath()));
        args.addAll(List.of("-vf", videoFilter(segment, settings)));
        args.addAll(List.of(
                "-an",
                "-c:v", "libx264",
                "-preset", tier.getX264Preset(),
                "-crf", String.valueOf(tier.getCrf()),
                "-pix_fmt", "yuv420p",
                "-r", String.valueOf(properties.getFps()),
                "-t", duration,
                out.toString()));
        return args;
    }

    String videoFilter(SceneSegment segment, CompositionSettings settings) {
        int w = settings.getWidth();
        int h = settings.getHeight();
        double d = segment.durationSeconds();
        double fade = Math.min(properties.getTransitionSeconds(), d / 4);

        StringBuilder vf = new StringBuilder();
        vf.append("scale=").append(w).append(':').append(h).append(":force_original_aspect_ratio=increase")
                .append(",crop=").append(w).append(':').append(h)
                .append(",setsar=1")
                .append(",fps=").append(properties.getFps())
                .append(",fade=t=in:st=0:d=").append(format(fade))
                .append(",fade=t=out:st=").append(format(d - fade)).append(":d=").append(format(fade));

        if (segment.getOverlay() != null) {
            // 캡션은 모델이 만든 문자열이므로 % 확장을 끈다
            vf.append(",drawtext=textfile=").append(escapeFilterValue(segment.getOverlay().getFilePath()))
                    .append(":expansion=none");
            if (properties.getFontFile() != null && !properties.getFontFile().isBlank()) {
                vf.append(":fontfile=").append(escapeFilterValue(properties.getFontFile()));
            }
            vf.append(":fontsize=").append(Math.max(24, h / 20))
                    .append(":fontcolor=white:borderw=3:bordercolor=black")
                    .append(":x=(w-text_w)/2:y=h-text_h-").append(h / 12);
        }
        return vf.toString();
    }

    /**
     * 필터 옵션 값 이스케이프 (옵션 단계 + 필터그래프 단계)
     * /data/it's:a,b → /data/it\\\'s\\:a\,b
     */
    static String escapeFilterValue(String value) {
        StringBuilder option = new StringBuilder();
        for (char c : value.toCharArray()) {
            if (c == '\\' || c == '\'' || c == ':') {
                option.append('\\');
            }
            option.append(c);
        }
        StringBuilder graph = new StringBuilder();
        for (char c : option.toString().toCharArray()) {
            if (c == '\\' || c == '\'' || c == '[' || c == ']' || c == ',' || c == ';') {
                graph.append('\\');
            }
            graph.append(c);
        }
        return graph.toString();
    }

    static List<String> concatArgs(Path listFile, Path out) {
        return List.of("-f", "concat", "-safe", "0", "-i", listFile.toString(), "-c", "copy", out.toString());
    }

    /**
     * 나레이션 트랙: 장면별 오디오를 장면 길이에 맞춰 apad + atrim, 오디오 없는 장면은 무음
     */
    List<String> muxArgs(Path video, List<SceneSegment> segments, CompositionSettings settings, Path out) {
        List<String> args = new ArrayList<>(List.of("-i", video.toString()));
        StringBuilder filter = new StringBuilder();
        StringBuilder concatInputs = new StringBuilder();

        int inputIndex = 1;
        for (int i = 0; i < segments.size(); i++) {
            SceneSegment segment = segments.get(i);
            String d = seconds(segment.getDurationMillis());
            String label = "a" + i;
            if (segment.getAudio() != null) {
                args.addAll(List.of("-i", segment.getAudio().getFilePath()));
                filter.append('[').append(inputIndex++).append(":a]")
                        .append("aresample=").append(AUDIO_SAMPLE_RATE)
                        .append(",aformat=channel_layouts=stereo")
                        .append(",apad,atrim=0:").append(d)
                        .append(",asetpts=N/SR/TB[").append(label).append("];");
            } else {
                filter.append("anullsrc=channel_layout=stereo:sample_rate=").append(AUDIO_SAMPLE_RATE)
                        .append(",atrim=0:").append(d)
                        .append(",asetpts=N/SR/TB[").append(label).append("];");
            }
            concatInputs.append('[').append(label).append(']');
        }
        filter.append(concatInputs).append("concat=n=").append(segments.size()).append(":v=0:a=1[aout]");

        args.addAll(List.of(
                "-filter_complex", filter.toString(),
                "-map", "0:v",
                "-map", "[aout]",
                "-c:v", "copy",
                "-c:a", "aac",
                "-b:a", "192k",
                "-t", seconds(settings.getDurationSeconds() * 1000L),
                "-movflags", "+faststart",
                out.toString()));
        return args;
    }

    // ========== 유틸 ==========

    private static void writeConcatList(Path listFile, List<Path> segments) throws StorageException {
        StringBuilder content = new StringBuilder();
        for (Path segment : segments) {
            content.append("file '").append(segment.toAbsolutePath()).append("'\n");
        }
        try {
            Files.writeString(listFile, content.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_IO_FAILED, "concat 목록 작성 실패", e);
        }
    }

    private static Asset find(List<Asset> assets, AssetType type) {
        for (Asset asset : assets) {
            if (asset.getAssetType() == type) {
                return asset;
            }
        }
        return null;
    }

    private static long fileSize(Path path) throws StorageException {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_IO_FAILED, "최종 영상 크기 확인 실패", e);
        }
    }

    static String seconds(long millis) {
        return format(millis / 1000.0);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
