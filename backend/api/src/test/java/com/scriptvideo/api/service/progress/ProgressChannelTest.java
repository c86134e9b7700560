package com.scriptvideo.api.service.progress;

import com.scriptvideo.api.entity.ProgressEvent;
import com.scriptvideo.common.enums.JobStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressChannelTest {

    private final ProgressChannel channel = new ProgressChannel();

    @AfterEach
    void tearDown() {
        channel.shutdown();
    }

    @Test
    void deliversOnlyToSubscribersOfTheJobInOrder() throws Exception {
        List<Long> jobA = new CopyOnWriteArrayList<>();
        List<Long> jobB = new CopyOnWriteArrayList<>();
        channel.subscribe("a", e -> jobA.add(e.getSequenceNumber()));
        channel.subscribe("b", e -> jobB.add(e.getSequenceNumber()));

        for (int i = 1; i <= 50; i++) {
            channel.publish(event("a", i));
        }
        channel.publish(event("b", 1));

        assertThat(channel.awaitDrained(5, TimeUnit.SECONDS)).isTrue();
        assertThat(jobA).hasSize(50).isSorted();
        assertThat(jobB).containsExactly(1L);
    }

    @Test
    void unsubscribedListenerReceivesNothingFurther() throws Exception {
        List<Long> received = new CopyOnWriteArrayList<>();
        String subscriptionId = channel.subscribe("a", e -> received.add(e.getSequenceNumber()));

        channel.publish(event("a", 1));
        channel.unsubscribe("a", subscriptionId);
        channel.publish(event("a", 2));

        assertThat(channel.awaitDrained(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).containsExactly(1L);
    }

    @Test
    void failingSubscriberIsRemovedWithoutAffectingOthers() throws Exception {
        List<Long> failing = new CopyOnWriteArrayList<>();
        List<Long> healthy = new CopyOnWriteArrayList<>();
        channel.subscribe("a", e -> {
            failing.add(e.getSequenceNumber());
            throw new IllegalStateException("connection reset");
        });
        channel.subscribe("a", e -> healthy.add(e.getSequenceNumber()));

        channel.publish(event("a", 1));
        channel.publish(event("a", 2));

        assertThat(channel.awaitDrained(5, TimeUnit.SECONDS)).isTrue();
        assertThat(failing).containsExactly(1L);
        assertThat(healthy).containsExactly(1L, 2L);
    }

    @Test
    void stalledSubscriberDoesNotDelayOtherJobs() throws Exception {
        CountDownLatch stalledEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch otherReceived = new CountDownLatch(1);
        List<Long> stalled = new CopyOnWriteArrayList<>();
        channel.subscribe("slow", e -> {
            stalledEntered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            stalled.add(e.getSequenceNumber());
        });
        channel.subscribe("fast", e -> otherReceived.countDown());

        channel.publish(event("slow", 1));
        channel.publish(event("slow", 2));
        assertThat(stalledEntered.await(5, TimeUnit.SECONDS)).isTrue();
        channel.publish(event("fast", 1));

        // 느린 구독자가 막혀 있는 동안에도 다른 작업은 전달됨
        assertThat(otherReceived.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(stalled).isEmpty();

        release.countDown();
        assertThat(channel.awaitDrained(5, TimeUnit.SECONDS)).isTrue();
        assertThat(stalled).containsExactly(1L, 2L);
    }

    private static ProgressEvent event(String jobId, long sequence) {
        return ProgressEvent.builder()
                .jobId(jobId)
                .sequenceNumber(sequence)
                .stage(JobStatus.GENERATING_ASSETS)
                .percentage(50)
                .build();
    }
}
