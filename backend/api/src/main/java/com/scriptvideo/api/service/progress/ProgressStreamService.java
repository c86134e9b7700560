package com.scriptvideo.api.service.progress;

import com.scriptvideo.api.entity.ProgressEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;

/**
 * 진행 이벤트 SSE 스트림
 *
 * 채널 구독을 먼저 걸고 보관된 이벤트를 재전송한 뒤 실시간 이벤트를 이어 보낸다.
 * 재전송과 실시간 전달이 겹치는 구간은 sequence 로 중복을 거른다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressStreamService {

    private final ProgressChannel channel;
    private final ProgressPublisher publisher;

    @Value("${progress.sse-timeout:PT35M}")
    private Duration sseTimeout;

    /**
     * @param afterSequence 클라이언트가 마지막으로 받은 sequence (처음이면 0)
     * @param jobFinished 작업이 이미 종료되었는지 (재전송 후 바로 닫음)
     */
    public SseEmitter open(String jobId, long afterSequence, boolean jobFinished) {
        SseEmitter emitter = new SseEmitter(sseTimeout.toMillis());
        StreamState state = new StreamState(jobId, afterSequence, emitter);

        synchronized (state) {
            String subscriptionId = channel.subscribe(jobId, state::deliver);
            state.subscriptionId = subscriptionId;
            emitter.onCompletion(() -> channel.unsubscribe(jobId, subscriptionId));
            emitter.onTimeout(() -> {
                channel.unsubscribe(jobId, subscriptionId);
                emitter.complete();
            });
            emitter.onError(e -> channel.unsubscribe(jobId, subscriptionId));

            List<ProgressEvent> missed = publisher.replay(jobId, afterSequence);
            try {
                for (ProgressEvent event : missed) {
                    state.send(event);
                }
            } catch (UncheckedIOException e) {
                log.debug("[Progress] SSE client gone during replay - jobId: {}", jobId);
                return emitter;
            }
            if (jobFinished && !state.finished) {
                state.finish();
            }
        }
        log.info("[Progress] SSE opened - jobId: {}, after: {}, replayed: {}", jobId, afterSequence, state.lastSent);
        return emitter;
    }

    private final class StreamState {
        private final String jobId;
        private final SseEmitter emitter;
        private long lastSent;
        private boolean finished;
        private String subscriptionId;

        private StreamState(String jobId, long afterSequence, SseEmitter emitter) {
            this.jobId = jobId;
            this.lastSent = afterSequence;
            this.emitter = emitter;
        }

        private synchronized void deliver(ProgressEvent event) {
            // 전송 실패는 UncheckedIOException 으로 올려 채널이 구독을 해지하게 한다
            send(event);
        }

        private void send(ProgressEvent event) {
            if (finished || event.getSequenceNumber() <= lastSent) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                        .id(String.valueOf(event.getSequenceNumber()))
                        .name("progress")
                        .data(event));
            } catch (IOException e) {
                finished = true;
                emitter.completeWithError(e);
                throw new UncheckedIOException(e);
            }
            lastSent = event.getSequenceNumber();
            if (event.isTerminal()) {
                finish();
            }
        }

        private void finish() {
            finished = true;
            if (subscriptionId != null) {
                channel.unsubscribe(jobId, subscriptionId);
            }
            emitter.complete();
        }
    }
}
