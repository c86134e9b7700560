package com.scriptvideo.api.service.compose;

import com.scriptvideo.api.config.FfmpegProperties;
import com.scriptvideo.api.util.Diagnostics;
import com.scriptvideo.api.util.ProcessExecutor;
import com.scriptvideo.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * FFmpeg / ffprobe 프로세스 실행
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FfmpegEncoder implements MediaEncoder {

    private static final String[] UNSUPPORTED_CODEC_PATTERNS = {
            "Unknown encoder", "Encoder not found", "Unknown decoder", "Decoder not found",
            "codec not currently supported"
    };

    private final FfmpegProperties properties;

    @Override
    public void encode(List<String> args, String taskName) throws CompositionException {
        List<String> command = new ArrayList<>();
        command.add(properties.getBinary());
        command.add("-y");
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add("error");
        command.addAll(args);

        ProcessExecutor.Result result = run(command, taskName);
        if (!result.isSuccess()) {
            String output = result.getOutput();
            log.error("[Composer] FFmpeg {} failed (exit {}): {}", taskName, result.getExitCode(), Diagnostics.forLog(output));
            throw new CompositionException(classify(output),
                    "FFmpeg " + taskName + " 실패 (exit " + result.getExitCode() + ")",
                    Diagnostics.forStore(output));
        }
    }

    @Override
    public double probeDuration(Path media) throws CompositionException {
        List<String> command = List.of(
                properties.getProbeBinary(),
                "-v", "error",
                "-show_entries", "format=duration",
                "-of", "default=noprint_wrappers=1:nokey=1",
                media.toAbsolutePath().toString());

        ProcessExecutor.Result result = run(command, "probe");
        String output = result.getOutput() != null ? result.getOutput().trim() : "";
        if (!result.isSuccess()) {
            throw new CompositionException(ErrorCode.VIDEO_FFMPEG_FAILED,
                    "ffprobe 실패: " + media.getFileName(), Diagnostics.forStore(output));
        }
        try {
            String firstLine = output.lines().findFirst().orElse("").trim();
            return Double.parseDouble(firstLine);
        } catch (NumberFormatException e) {
            throw new CompositionException(ErrorCode.VIDEO_FFMPEG_FAILED,
                    "ffprobe 길이 파싱 실패: " + media.getFileName(), Diagnostics.forStore(output), e);
        }
    }

    private ProcessExecutor.Result run(List<String> command, String taskName) throws CompositionException {
        try {
            return ProcessExecutor.execute(command, taskName,
                    properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new CompositionException(ErrorCode.VIDEO_FFMPEG_FAILED,
                    "FFmpeg " + taskName + " 시간 초과", e.getMessage(), e);
        } catch (IOException e) {
            throw new CompositionException(ErrorCode.VIDEO_FFMPEG_FAILED,
                    "FFmpeg 실행 실패: " + taskName, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompositionException(ErrorCode.VIDEO_FFMPEG_FAILED,
                    "FFmpeg " + taskName + " 중단됨", e.getMessage(), e);
        }
    }

    static ErrorCode classify(String output) {
        if (output != null) {
            String lower = output.toLowerCase(Locale.ROOT);
            for (String pattern : UNSUPPORTED_CODEC_PATTERNS) {
                if (lower.contains(pattern.toLowerCase(Locale.ROOT))) {
                    return ErrorCode.VIDEO_UNSUPPORTED_CODEC;
                }
            }
        }
        return ErrorCode.VIDEO_FFMPEG_FAILED;
    }
}
