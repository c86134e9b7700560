package com.scriptvideo.api.service.progress;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scriptvideo.api.entity.ProgressEvent;
import com.scriptvideo.api.entity.ProgressEvent.ErrorContext;
import com.scriptvideo.common.enums.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 진행 이벤트 발행
 *
 * 작업별 잠금 안에서 sequence 를 부여하고 곧바로 채널에 넣으므로,
 * 채널에 들어가는 순서와 sequence 순서가 항상 같다.
 * - 종료 전 진행률이 줄어드는 이벤트는 로그만 남기고 버림
 * - 종료 이벤트 이후의 이벤트는 버림
 * - 최근 이벤트는 재전송(누락 복구)용으로 보관
 * - 진행 중인 작업의 상태는 만료되지 않고, 종료된 작업만 유예 시간 뒤 제거
 */
@Slf4j
@Service
public class ProgressPublisher {

    static final int RECENT_EVENT_LIMIT = 500;
    static final Duration CLOSED_RETENTION = Duration.ofHours(6);

    private final ProgressChannel channel;

    // 작업별 sequence 상태
    private final Cache<String, JobSequence> sequences;

    @Autowired
    public ProgressPublisher(ProgressChannel channel) {
        this(channel, Ticker.systemTicker());
    }

    ProgressPublisher(ProgressChannel channel, Ticker ticker) {
        this.channel = channel;
        this.sequences = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfter(new ClosedSequenceExpiry())
                .build();
    }

    public Optional<ProgressEvent> publish(String jobId, JobStatus stage, String message, int percentage,
                                           Map<String, Object> metrics) {
        return publish(jobId, stage, message, percentage, metrics, null);
    }

    /**
     * @return 발행된 이벤트 (규칙 위반으로 버려졌으면 empty)
     */
    public Optional<ProgressEvent> publish(String jobId, JobStatus stage, String message, int percentage,
                                           Map<String, Object> metrics, ErrorContext errorContext) {
        JobSequence sequence = sequences.get(jobId, k -> new JobSequence());
        synchronized (sequence) {
            if (sequence.closed) {
                log.debug("[Progress] Dropped event after terminal - jobId: {}, stage: {}", jobId, stage);
                return Optional.empty();
            }
            int clamped = Math.max(0, Math.min(100, percentage));
            if (!stage.isTerminal() && clamped < sequence.lastPercentage) {
                log.warn("[Progress] Dropped decreasing percentage - jobId: {}, stage: {}, {} < {}",
                        jobId, stage, clamped, sequence.lastPercentage);
                return Optional.empty();
            }

            int effective = stage == JobStatus.COMPLETED ? 100 : Math.max(clamped, sequence.lastPercentage);
            LocalDateTime now = LocalDateTime.now();
            if (sequence.startedAt == null) {
                sequence.startedAt = now;
            }

            ProgressEvent event = ProgressEvent.builder()
                    .jobId(jobId)
                    .sequenceNumber(++sequence.lastSequence)
                    .stage(stage)
                    .message(message)
                    .percentage(effective)
                    .estimatedRemainingSeconds(estimateRemaining(sequence.startedAt, now, effective, stage))
                    .metrics(metrics != null ? Map.copyOf(metrics) : Map.of())
                    .errorContext(errorContext)
                    .timestamp(now)
                    .build();

            sequence.lastPercentage = effective;
            sequence.recent.addLast(event);
            if (sequence.recent.size() > RECENT_EVENT_LIMIT) {
                sequence.recent.removeFirst();
            }
            if (stage.isTerminal()) {
                sequence.closed = true;
                // 만료 시간 재계산
                sequences.put(jobId, sequence);
            }

            channel.publish(event);
            log.debug("[Progress] jobId: {}, seq: {}, stage: {}, {}%", jobId, event.getSequenceNumber(), stage, effective);
            return Optional.of(event);
        }
    }

    /**
     * afterSequence 이후 보관된 이벤트 (누락 복구용)
     */
    public List<ProgressEvent> replay(String jobId, long afterSequence) {
        JobSequence sequence = sequences.getIfPresent(jobId);
        if (sequence == null) {
            return List.of();
        }
        synchronized (sequence) {
            List<ProgressEvent> events = new ArrayList<>();
            for (ProgressEvent event : sequence.recent) {
                if (event.getSequenceNumber() > afterSequence) {
                    events.add(event);
                }
            }
            return events;
        }
    }

    public Optional<ProgressEvent> latest(String jobId) {
        JobSequence sequence = sequences.getIfPresent(jobId);
        if (sequence == null) {
            return Optional.empty();
        }
        synchronized (sequence) {
            return Optional.ofNullable(sequence.recent.peekLast());
        }
    }

    private static Long estimateRemaining(LocalDateTime startedAt, LocalDateTime now, int percentage, JobStatus stage) {
        if (stage.isTerminal()) {
            return 0L;
        }
        if (percentage <= 0) {
            return null;
        }
        long elapsed = Duration.between(startedAt, now).getSeconds();
        return elapsed * (100 - percentage) / percentage;
    }

    /**
     * 종료 전에는 만료 없음, 종료 후에는 마지막 접근부터 CLOSED_RETENTION
     */
    private static final class ClosedSequenceExpiry implements Expiry<String, JobSequence> {

        @Override
        public long expireAfterCreate(String jobId, JobSequence sequence, long currentTime) {
            return durationFor(sequence);
        }

        @Override
        public long expireAfterUpdate(String jobId, JobSequence sequence, long currentTime, long currentDuration) {
            return durationFor(sequence);
        }

        @Override
        public long expireAfterRead(String jobId, JobSequence sequence, long currentTime, long currentDuration) {
            return durationFor(sequence);
        }

        private static long durationFor(JobSequence sequence) {
            return sequence.closed ? CLOSED_RETENTION.toNanos() : Long.MAX_VALUE;
        }
    }

    private static final class JobSequence {
        private long lastSequence;
        private int lastPercentage;
        private volatile boolean closed;
        private LocalDateTime startedAt;
        private final Deque<ProgressEvent> recent = new ArrayDeque<>();
    }
}
