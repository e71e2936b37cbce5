package com.ryuqq.printqueue.adapter.runner;

import com.ryuqq.printqueue.application.runtime.NotificationRuntime;
import com.ryuqq.printqueue.core.event.Promoted;
import com.ryuqq.printqueue.core.spi.NotificationBus;
import com.ryuqq.printqueue.core.spi.PromotionNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Notification Dispatcher 구현체.
 *
 * <p>알림 버스에서 {@link Promoted} 이벤트를 가져와 채팅 어댑터로 전달합니다.
 * 대기열 관리자의 임계 구역 밖에서 동작하므로, 전달 지연이나 실패가 대기열 변경을 막지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * dequeue(batchSize) → [Promoted1, Promoted2, ...]
 *   ↓
 * For each Promoted (전달 스레드 풀에서 병렬):
 *   1. notifier.deliver(event)
 *   2. 실패 시:
 *      - attempt &lt; maxAttempts → nack (attempt + 1로 재적재)
 *      - attempt &gt;= maxAttempts → DLQ
 *   ↓
 * 배치 전체 처리 완료 후 반환
 * </pre>
 *
 * <p>{@link #start()}는 pollingIntervalMs 간격으로 pump()를 예약하며,
 * {@link #shutdown()}은 예약을 멈추고 진행 중인 전달을 기다립니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public final class NotificationDispatcher implements NotificationRuntime {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationBus bus;
    private final PromotionNotifier notifier;
    private final DispatcherConfig config;
    private final ExecutorService deliveryExecutor;

    private ScheduledExecutorService scheduler;
    private volatile boolean shutdown;

    /**
     * 생성자.
     *
     * @param bus 알림 버스
     * @param notifier 채팅 어댑터의 알림 전달자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public NotificationDispatcher(NotificationBus bus, PromotionNotifier notifier, DispatcherConfig config) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.bus = bus;
        this.notifier = notifier;
        this.config = config;
        AtomicInteger threadIndex = new AtomicInteger();
        this.deliveryExecutor = Executors.newFixedThreadPool(config.concurrency(), r -> {
            Thread thread = new Thread(r, "printqueue-delivery-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void pump() {
        if (shutdown) {
            throw new IllegalStateException("dispatcher has been shut down");
        }

        // 1. 배치 dequeue
        List<Promoted> events = bus.dequeue(config.batchSize());
        if (events.isEmpty()) {
            return;
        }

        // 2. 병렬 전달
        List<Future<?>> deliveries = new ArrayList<>(events.size());
        for (Promoted event : events) {
            deliveries.add(deliveryExecutor.submit(() -> deliver(event)));
        }

        // 3. 배치 완료 대기
        for (Future<?> delivery : deliveries) {
            try {
                delivery.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Interrupted while waiting for deliveries", e);
            } catch (ExecutionException e) {
                log.error("Delivery task failed unexpectedly", e.getCause());
            }
        }
    }

    /**
     * pollingIntervalMs 간격으로 pump() 예약 시작.
     *
     * @throws IllegalStateException 이미 시작되었거나 종료된 경우
     */
    public synchronized void start() {
        if (shutdown) {
            throw new IllegalStateException("dispatcher has been shut down");
        }
        if (scheduler != null) {
            throw new IllegalStateException("dispatcher already started");
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "printqueue-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::scheduledPump, 0, config.pollingIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Notification dispatcher started (interval: {}ms, maxAttempts: {})",
            config.pollingIntervalMs(), config.maxAttempts());
    }

    /**
     * Dispatcher 종료 (리소스 정리).
     *
     * <p>예약을 멈추고, 진행 중인 전달이 shutdownTimeoutMs 안에 끝나도록 기다립니다.
     * 버스에 남은 이벤트는 전달되지 않습니다.</p>
     */
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;

        if (scheduler != null) {
            terminate(scheduler);
        }
        terminate(deliveryExecutor);
        log.info("Notification dispatcher stopped");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * 이벤트 전달. 예외는 이 메서드 밖으로 나가지 않습니다.
     *
     * @param event 전달할 이벤트
     */
    private void deliver(Promoted event) {
        try {
            notifier.deliver(event);
            log.debug("Notified {} (attempt {})", event.participant().getValue(), event.attempt());
        } catch (Exception e) {
            handleFailure(event, e);
        }
    }

    private void handleFailure(Promoted event, Exception failure) {
        String participant = event.participant().getValue();

        if (event.attempt() < config.maxAttempts()) {
            log.warn("Notification to {} failed (attempt {}/{}), will retry: {}",
                participant, event.attempt(), config.maxAttempts(), failure.getMessage());
            bus.nack(event);
        } else {
            log.error("Notification to {} failed after {} attempts, moving to dead letter queue",
                participant, event.attempt(), failure);
            bus.publishToDeadLetter(event, describe(failure));
        }
    }

    private void scheduledPump() {
        if (shutdown) {
            return;
        }
        try {
            pump();
        } catch (RuntimeException e) {
            // 예약 작업이 예외로 끝나면 이후 실행이 중단되므로 여기서 기록만 함
            log.error("Notification pump cycle failed", e);
        }
    }

    private void terminate(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static String describe(Exception failure) {
        String message = failure.getMessage();
        String type = failure.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
