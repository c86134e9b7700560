package com.scriptvideo.api;

import com.scriptvideo.api.entity.Job;
import com.scriptvideo.api.entity.ProgressEvent;
import com.scriptvideo.api.service.ai.ModelProvider;
import com.scriptvideo.api.service.ai.ModelResponse;
import com.scriptvideo.api.service.compose.FakeMediaEncoder;
import com.scriptvideo.api.service.job.JobStore;
import com.scriptvideo.api.service.progress.ProgressPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.util.Optional;
import java.util.StringJoiner;

/**
 * 통합 테스트 공통 설정 (H2 + 모델 mock + 가짜 인코더)
 * 모든 통합 테스트가 같은 컨텍스트를 공유한다.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(IntegrationTestSupport.FakeEncoderConfig.class)
public abstract class IntegrationTestSupport {

    private static final long TERMINAL_WAIT_MILLIS = 20_000;

    @MockBean
    protected ModelProvider modelProvider;

    @Autowired
    protected FakeMediaEncoder mediaEncoder;

    @Autowired
    protected JobStore jobStore;

    @Autowired
    protected ProgressPublisher progressPublisher;

    @TestConfiguration
    static class FakeEncoderConfig {
        @Bean
        @Primary
        FakeMediaEncoder fakeMediaEncoder() {
            return new FakeMediaEncoder();
        }
    }

    @BeforeEach
    void resetEncoder() {
        mediaEncoder.reset();
    }

    /**
     * 작업 상태와 마지막 진행 이벤트가 모두 종료될 때까지 대기
     */
    protected Job awaitTerminal(String jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TERMINAL_WAIT_MILLIS;
        while (System.currentTimeMillis() < deadline) {
            Job job = jobStore.get(jobId);
            Optional<ProgressEvent> latest = progressPublisher.latest(jobId);
            if (job.isTerminal() && latest.isPresent() && latest.get().isTerminal()) {
                return job;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("Job did not finish in time: " + jobId + " (" + jobStore.get(jobId).getStatus() + ")");
    }

    protected static String scenesJson(int count) {
        StringJoiner scenes = new StringJoiner(",", "{\"scenes\": [", "]}");
        for (int i = 0; i < count; i++) {
            scenes.add("{\"theme\": \"장면 " + i + "\", \"visual\": \"harbor view " + i + "\", "
                    + "\"narration\": \"나레이션 " + i + "\", \"durationWeight\": " + (i % 2 == 0 ? 1 : 2) + "}");
        }
        return scenes.toString();
    }

    protected static ModelResponse<String> text(String payload) {
        return ModelResponse.<String>builder()
                .payload(payload)
                .mimeType("application/json")
                .endpoint("text-a")
                .unitsConsumed(100)
                .responseTimeMs(3)
                .requestCount(1)
                .build();
    }

    protected static ModelResponse<byte[]> image() {
        return ModelResponse.<byte[]>builder()
                .payload(new byte[]{(byte) 0x89, 'P', 'N', 'G'})
                .mimeType("image/png")
                .endpoint("image-a")
                .responseTimeMs(3)
                .requestCount(1)
                .build();
    }

    // 24kHz mono 16-bit PCM 1초
    protected static ModelResponse<byte[]> speech() {
        return ModelResponse.<byte[]>builder()
                .payload(new byte[48_000])
                .mimeType("audio/pcm")
                .endpoint("speech-a")
                .responseTimeMs(3)
                .requestCount(1)
                .build();
    }
}
