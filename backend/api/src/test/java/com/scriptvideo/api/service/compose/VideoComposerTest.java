package com.scriptvideo.api.service.compose;

import com.scriptvideo.api.config.FfmpegProperties;
import com.scriptvideo.api.config.StorageProperties;
import com.scriptvideo.api.entity.Asset;
import com.scriptvideo.api.entity.CompositionSettings;
import com.scriptvideo.api.entity.GeneratedVideo;
import com.scriptvideo.api.service.job.JobStore;
import com.scriptvideo.api.service.storage.StorageManager;
import com.scriptvideo.common.enums.AssetType;
import com.scriptvideo.common.enums.QualityTier;
import com.scriptvideo.common.enums.StorageArea;
import com.scriptvideo.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VideoComposerTest {

    @TempDir
    Path tempDir;

    private final FakeMediaEncoder encoder = new FakeMediaEncoder();
    private final FfmpegProperties ffmpegProperties = new FfmpegProperties();
    private StorageManager storageManager;
    private VideoComposer composer;

    private final CompositionSettings settings = CompositionSettings.builder()
            .width(1280).height(720).durationSeconds(30).qualityTier(QualityTier.DRAFT).includeAudio(true).build();

    @BeforeEach
    void setUp() {
        StorageProperties storageProperties = new StorageProperties();
        storageProperties.setBasePath(tempDir.toString());
        storageProperties.setMinFreeSpaceMb(0);
        storageManager = new StorageManager(storageProperties, Mockito.mock(JobStore.class));
        storageManager.init();
        composer = new VideoComposer(encoder, storageManager, ffmpegProperties);
    }

    @Test
    void composesScenesInOrderAndMovesResultToVideos() throws Exception {
        List<Asset> assets = threeScenes();

        GeneratedVideo video = composer.compose("job-1", assets, settings);

        assertThat(encoder.tasks()).containsExactly("segment-0", "segment-1", "segment-2", "concat", "mux-audio");
        assertThat(video.getDurationSeconds()).isEqualTo(30.0);
        assertThat(video.getResolution()).isEqualTo("1280x720");
        assertThat(video.getFormat()).isEqualTo("mp4");
        assertThat(Path.of(video.getFilePath())).exists()
                .hasParent(storageManager.jobDirectory("job-1", StorageArea.VIDEOS));
        assertThat(video.getFileSizeBytes()).isPositive();
    }

    @Test
    void sceneDurationsFollowWeightsAndSumToTarget() throws Exception {
        List<SceneSegment> segments = composer.planScenes(threeScenes(), settings);

        assertThat(segments).extracting(SceneSegment::getDurationMillis).containsExactly(7_500L, 15_000L, 7_500L);
        assertThat(segments.get(1).getAudio()).isNull();
        assertThat(segments.get(0).getAudio()).isNotNull();
    }

    @Test
    void clipIsPreferredOverImageAndLooped() throws Exception {
        List<Asset> assets = new ArrayList<>();
        assets.add(asset(0, AssetType.IMAGE, 1.0));
        assets.add(asset(0, AssetType.VIDEO_CLIP, 1.0));

        SceneSegment segment = composer.planScenes(assets, settings).get(0);
        List<String> args = composer.segmentArgs(segment, settings, tempDir.resolve("out.mp4"));

        assertThat(segment.isClip()).isTrue();
        assertThat(args).startsWith("-stream_loop", "-1");
        assertThat(args).contains("-preset", "veryfast", "-crf", "28");
    }

    @Test
    void overlayIsDrawnOnSegment() throws Exception {
        List<Asset> assets = List.of(asset(0, AssetType.IMAGE, 1.0), asset(0, AssetType.TEXT_OVERLAY, 1.0));

        SceneSegment segment = composer.planScenes(assets, settings).get(0);

        assertThat(composer.videoFilter(segment, settings))
                .startsWith("scale=1280:720")
                .contains("fade=t=in:st=0:d=0.500")
                .contains("drawtext=textfile=/assets/scene-0-TEXT_OVERLAY:expansion=none");
    }

    @Test
    void overlayPathsAreEscapedForFilterGraph() throws Exception {
        ffmpegProperties.setFontFile("C:\\fonts\\Nanum Gothic.ttf");
        Asset overlay = Asset.builder()
                .jobId("job-1")
                .sceneIndex(0)
                .assetType(AssetType.TEXT_OVERLAY)
                .filePath("/data/it's:100%,fresh.txt")
                .durationWeight(1.0)
                .build();
        List<Asset> assets = List.of(asset(0, AssetType.IMAGE, 1.0), overlay);

        String filter = composer.videoFilter(composer.planScenes(assets, settings).get(0), settings);

        assertThat(filter)
                .contains("drawtext=textfile=/data/it\\\\\\'s\\\\:100%\\,fresh.txt:expansion=none")
                .contains(":fontfile=C\\\\:\\\\\\\\fonts\\\\\\\\Nanum Gothic.ttf");
        assertThat(VideoComposer.escapeFilterValue("/plain/path.txt")).isEqualTo("/plain/path.txt");
    }

    @Test
    void audioIsSkippedWhenNotRequested() throws Exception {
        CompositionSettings silent = CompositionSettings.builder()
                .width(1280).height(720).durationSeconds(30).qualityTier(QualityTier.STANDARD).includeAudio(false).build();

        composer.compose("job-1", threeScenes(), silent);

        assertThat(encoder.tasks()).endsWith("finalize").doesNotContain("mux-audio");
        assertThat(encoder.invocations().get(encoder.invocations().size() - 1)).contains("-an");
    }

    @Test
    void durationOutsideToleranceFails() {
        encoder.overrideDuration(27.5);

        assertThatThrownBy(() -> composer.compose("job-1", threeScenes(), settings))
                .isInstanceOf(CompositionException.class)
                .extracting(e -> ((CompositionException) e).getErrorCode())
                .isEqualTo(ErrorCode.VIDEO_DURATION_MISMATCH);
    }

    @Test
    void encoderFailureCarriesOutputAsDiagnostic() {
        encoder.failOn("segment-1", "[libx264 @ 0x1] Unknown encoder 'libx264'");

        assertThatThrownBy(() -> composer.compose("job-1", threeScenes(), settings))
                .isInstanceOf(CompositionException.class)
                .satisfies(e -> {
                    CompositionException ce = (CompositionException) e;
                    assertThat(ce.getErrorCode()).isEqualTo(ErrorCode.VIDEO_UNSUPPORTED_CODEC);
                    assertThat(ce.getDiagnostic()).contains("Unknown encoder");
                });
    }

    @Test
    void sceneWithoutVisualAssetIsRejected() {
        List<Asset> assets = List.of(asset(0, AssetType.AUDIO, 1.0));

        assertThatThrownBy(() -> composer.planScenes(assets, settings))
                .isInstanceOf(CompositionException.class)
                .extracting(e -> ((CompositionException) e).getErrorCode())
                .isEqualTo(ErrorCode.VIDEO_COMPOSITION_FAILED);
    }

    @Test
    void emptyAssetListIsRejected() {
        assertThatThrownBy(() -> composer.planScenes(List.of(), settings))
                .isInstanceOf(CompositionException.class)
                .extracting(e -> ((CompositionException) e).getErrorCode())
                .isEqualTo(ErrorCode.VIDEO_COMPOSITION_NO_SCENES);
    }

    @Test
    void muxPadsScenesWithoutNarrationWithSilence() throws Exception {
        List<SceneSegment> segments = composer.planScenes(threeScenes(), settings);

        List<String> args = composer.muxArgs(tempDir.resolve("v.mp4"), segments, settings, tempDir.resolve("o.mp4"));

        String filter = args.get(args.indexOf("-filter_complex") + 1);
        assertThat(filter).contains("[1:a]").contains("[2:a]").contains("anullsrc");
        assertThat(filter).endsWith("concat=n=3:v=0:a=1[aout]");
        assertThat(args).contains("-t", "30.000");
    }

    // 장면 1 은 나레이션 없음, 가중치 1:2:1
    private static List<Asset> threeScenes() {
        List<Asset> assets = new ArrayList<>();
        assets.add(asset(0, AssetType.IMAGE, 1.0));
        assets.add(asset(0, AssetType.AUDIO, 1.0));
        assets.add(asset(1, AssetType.IMAGE, 2.0));
        assets.add(asset(2, AssetType.IMAGE, 1.0));
        assets.add(asset(2, AssetType.AUDIO, 1.0));
        return assets;
    }

    private static Asset asset(int scene, AssetType type, double weight) {
        return Asset.builder()
                .jobId("job-1")
                .sceneIndex(scene)
                .assetType(type)
                .filePath("/assets/scene-" + scene + "-" + type.name())
                .durationWeight(weight)
                .build();
    }
}
