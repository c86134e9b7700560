package com.scriptvideo.api.service.compose;

import com.scriptvideo.common.exception.ErrorCode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 테스트용 인코더
 * 마지막 인자(출력 파일)를 만들고, 길이는 마지막 -t 값으로 기록한다.
 */
public class FakeMediaEncoder implements MediaEncoder {

    private final List<String> tasks = new CopyOnWriteArrayList<>();
    private final List<List<String>> invocations = new CopyOnWriteArrayList<>();
    private final Map<Path, Double> durations = new ConcurrentHashMap<>();

    private volatile String failingTask;
    private volatile String failureOutput;
    private volatile Double durationOverride;

    @Override
    public void encode(List<String> args, String taskName) throws CompositionException {
        tasks.add(taskName);
        invocations.add(List.copyOf(args));
        if (taskName.equals(failingTask)) {
            throw new CompositionException(FfmpegEncoder.classify(failureOutput),
                    "FFmpeg " + taskName + " 실패 (exit 1)", failureOutput);
        }

        Path out = Path.of(args.get(args.size() - 1));
        try {
            Files.createDirectories(out.getParent());
            Files.write(out, ("encoded:" + taskName).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        int t = args.lastIndexOf("-t");
        if (t >= 0) {
            durations.put(out, Double.parseDouble(args.get(t + 1)));
        }
    }

    @Override
    public double probeDuration(Path media) throws CompositionException {
        if (durationOverride != null) {
            return durationOverride;
        }
        Double duration = durations.get(media);
        if (duration == null) {
            throw new CompositionException(ErrorCode.VIDEO_FFMPEG_FAILED, "ffprobe 실패: " + media.getFileName());
        }
        return duration;
    }

    public void failOn(String taskName, String output) {
        this.failingTask = taskName;
        this.failureOutput = output;
    }

    public void overrideDuration(Double seconds) {
        this.durationOverride = seconds;
    }

    public void reset() {
        tasks.clear();
        invocations.clear();
        durations.clear();
        failingTask = null;
        failureOutput = null;
        durationOverride = null;
    }

    public List<String> tasks() {
        return tasks;
    }

    public List<List<String>> invocations() {
        return invocations;
    }
}
