package com.scriptvideo.api.util;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * PCM 오디오 처리
 * Gemini TTS 출력: 16-bit PCM (signed, little-endian), 24000 Hz, mono
 */
public final class AudioUtils {

    public static final int TTS_SAMPLE_RATE = 24000;
    public static final int TTS_CHANNELS = 1;
    private static final int BITS_PER_SAMPLE = 16;

    private AudioUtils() {
    }

    /**
     * raw PCM → WAV 바이트
     */
    public static byte[] pcmToWav(byte[] pcm, int sampleRate, int channels) throws IOException {
        AudioFormat format = new AudioFormat(sampleRate, BITS_PER_SAMPLE, channels, true, false);
        long frames = pcm.length / format.getFrameSize();
        try (AudioInputStream in = new AudioInputStream(new ByteArrayInputStream(pcm), format, frames)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream(pcm.length + 64);
            AudioSystem.write(in, AudioFileFormat.Type.WAVE, out);
            return out.toByteArray();
        }
    }

    /**
     * PCM 길이(초) = 프레임 수 / 샘플레이트
     */
    public static double pcmDurationSeconds(int pcmBytes, int sampleRate, int channels) {
        int frameSize = (BITS_PER_SAMPLE / 8) * channels;
        return (double) (pcmBytes / frameSize) / sampleRate;
    }
}
