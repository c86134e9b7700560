package com.scriptvideo.api.service.progress;

import com.scriptvideo.api.entity.ProgressEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 진행 이벤트 공유 채널
 *
 * 구독자 목록(작업 ID → 구독자)은 디스패치 스레드 하나만 읽고 쓴다.
 * 발행/구독/해지는 모두 명령으로 큐에 넣고, 디스패치 스레드가 순서대로 처리한다.
 * 디스패치 스레드는 이벤트를 구독자별 우편함에 넣기만 하고,
 * 실제 전달(SSE 전송 등)은 구독자마다 따로 순서대로 실행된다.
 * 느린 구독자는 자기 우편함만 밀리고 다른 작업/구독자의 전달은 막지 않는다.
 * 같은 구독자에게는 넣은 순서대로 전달된다.
 */
@Slf4j
@Component
public class ProgressChannel {

    private sealed interface Command permits Publish, Subscribe, Unsubscribe, Barrier, Stop {}

    private record Publish(ProgressEvent event) implements Command {}

    private record Subscribe(String subscriptionId, String jobId, ProgressSubscriber subscriber) implements Command {}

    private record Unsubscribe(String subscriptionId, String jobId) implements Command {}

    private record Barrier(CountDownLatch latch) implements Command {}

    private record Stop() implements Command {}

    private record Registration(String subscriptionId, Mailbox mailbox) {}

    private final BlockingQueue<Command> queue = new LinkedBlockingQueue<>();

    // 디스패치 스레드 전용
    private final Map<String, List<Registration>> registry = new HashMap<>();

    private final Thread dispatcher;

    // 구독자별 전달 실행 (우편함 하나당 동시에 최대 하나의 drain)
    private final ExecutorService deliveryExecutor;

    public ProgressChannel() {
        AtomicInteger threadCount = new AtomicInteger();
        deliveryExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "progress-deliver-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        dispatcher = new Thread(this::dispatchLoop, "progress-dispatch");
        dispatcher.setDaemon(true);
        dispatcher.start();
    }

    public void publish(ProgressEvent event) {
        queue.add(new Publish(event));
    }

    /**
     * @return 구독 ID (해지에 사용)
     */
    public String subscribe(String jobId, ProgressSubscriber subscriber) {
        String subscriptionId = UUID.randomUUID().toString();
        queue.add(new Subscribe(subscriptionId, jobId, subscriber));
        return subscriptionId;
    }

    public void unsubscribe(String jobId, String subscriptionId) {
        queue.add(new Unsubscribe(subscriptionId, jobId));
    }

    /**
     * 지금까지 넣은 명령이 모두 처리되고 구독자 전달까지 끝날 때까지 대기
     * @return 시간 안에 처리되었으면 true
     */
    public boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        queue.add(new Barrier(latch));
        return latch.await(timeout, unit);
    }

    @PreDestroy
    public void shutdown() {
        queue.add(new Stop());
        deliveryExecutor.shutdown();
    }

    private void dispatchLoop() {
        while (true) {
            Command command;
            try {
                command = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[Progress] Dispatch thread interrupted, stopping");
                return;
            }

            if (command instanceof Publish publish) {
                deliver(publish.event());
            } else if (command instanceof Subscribe subscribe) {
                Mailbox mailbox = new Mailbox(subscribe.jobId(), subscribe.subscriptionId(), subscribe.subscriber());
                registry.computeIfAbsent(subscribe.jobId(), k -> new ArrayList<>())
                        .add(new Registration(subscribe.subscriptionId(), mailbox));
            } else if (command instanceof Unsubscribe unsubscribe) {
                remove(unsubscribe.jobId(), unsubscribe.subscriptionId());
            } else if (command instanceof Barrier barrier) {
                flushAll(barrier.latch());
            } else if (command instanceof Stop) {
                log.info("[Progress] Dispatch thread stopped");
                return;
            }
        }
    }

    private void deliver(ProgressEvent event) {
        List<Registration> registrations = registry.get(event.getJobId());
        if (registrations == null || registrations.isEmpty()) {
            return;
        }
        for (Registration registration : registrations) {
            registration.mailbox().offer(new Delivery(event, null));
        }
    }

    private void flushAll(CountDownLatch done) {
        List<Mailbox> mailboxes = registry.values().stream()
                .flatMap(List::stream)
                .map(Registration::mailbox)
                .toList();
        if (mailboxes.isEmpty()) {
            done.countDown();
            return;
        }
        AtomicInteger remaining = new AtomicInteger(mailboxes.size());
        Runnable onFlushed = () -> {
            if (remaining.decrementAndGet() == 0) {
                done.countDown();
            }
        };
        for (Mailbox mailbox : mailboxes) {
            mailbox.offer(new Delivery(null, onFlushed));
        }
    }

    private void remove(String jobId, String subscriptionId) {
        List<Registration> registrations = registry.get(jobId);
        if (registrations == null) {
            return;
        }
        registrations.removeIf(r -> r.subscriptionId().equals(subscriptionId));
        if (registrations.isEmpty()) {
            registry.remove(jobId);
        }
    }

    /**
     * 이벤트 또는 flush 표시 (둘 중 하나만 채워짐)
     */
    private record Delivery(ProgressEvent event, Runnable onFlushed) {}

    /**
     * 구독자 하나의 전달 큐
     * 전달에 실패하면 이후 이벤트는 버리고 구독 해지를 요청한다.
     */
    private final class Mailbox {
        private final String jobId;
        private final String subscriptionId;
        private final ProgressSubscriber subscriber;
        private final Queue<Delivery> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private volatile boolean failed;

        private Mailbox(String jobId, String subscriptionId, ProgressSubscriber subscriber) {
            this.jobId = jobId;
            this.subscriptionId = subscriptionId;
            this.subscriber = subscriber;
        }

        private void offer(Delivery delivery) {
            pending.add(delivery);
            schedule();
        }

        private void schedule() {
            if (draining.compareAndSet(false, true)) {
                try {
                    deliveryExecutor.execute(this::drain);
                } catch (RejectedExecutionException e) {
                    draining.set(false);
                    log.debug("[Progress] Channel stopped, dropping delivery - jobId: {}, subscription: {}",
                            jobId, subscriptionId);
                }
            }
        }

        private void drain() {
            try {
                Delivery delivery;
                while ((delivery = pending.poll()) != null) {
                    if (delivery.onFlushed() != null) {
                        delivery.onFlushed().run();
                    } else if (!failed) {
                        send(delivery.event());
                    }
                }
            } finally {
                draining.set(false);
            }
            // drain 종료 직전에 들어온 항목
            if (!pending.isEmpty()) {
                schedule();
            }
        }

        private void send(ProgressEvent event) {
            try {
                subscriber.onEvent(event);
            } catch (RuntimeException e) {
                failed = true;
                log.warn("[Progress] Subscriber failed, removing - jobId: {}, subscription: {}, error: {}",
                        jobId, subscriptionId, e.getMessage());
                unsubscribe(jobId, subscriptionId);
            }
        }
    }
}
