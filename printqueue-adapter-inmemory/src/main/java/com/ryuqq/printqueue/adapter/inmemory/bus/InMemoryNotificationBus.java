package com.ryuqq.printqueue.adapter.inmemory.bus;

import com.ryuqq.printqueue.core.event.Promoted;
import com.ryuqq.printqueue.core.spi.NotificationBus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-memory implementation of {@link NotificationBus}.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Main Queue:</strong> LinkedBlockingQueue&lt;Promoted&gt; - unbounded FIFO, never blocks the publisher</li>
 *   <li><strong>Dead Letter Queue:</strong> CopyOnWriteArrayList&lt;DeadLetter&gt; - events that exhausted their retries</li>
 * </ul>
 *
 * <p>Pending events are lost on restart. A participant promoted just before a crash is
 * not re-notified; the queue order itself is unaffected.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * NotificationBus bus = new InMemoryNotificationBus();
 * bus.publish(Promoted.now(participant));
 *
 * for (Promoted event : bus.dequeue(10)) {
 *     ...
 * }
 * </pre>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class InMemoryNotificationBus implements NotificationBus {

    private final LinkedBlockingQueue<Promoted> queue;
    private final List<DeadLetter> deadLetters;

    public InMemoryNotificationBus() {
        this.queue = new LinkedBlockingQueue<>();
        this.deadLetters = new CopyOnWriteArrayList<>();
    }

    @Override
    public void publish(Promoted event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        queue.offer(event);
    }

    @Override
    public List<Promoted> dequeue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }
        List<Promoted> batch = new ArrayList<>(Math.min(batchSize, 16));
        queue.drainTo(batch, batchSize);
        return batch;
    }

    @Override
    public void nack(Promoted event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        queue.offer(event.nextAttempt());
    }

    @Override
    public void publishToDeadLetter(Promoted event, String reason) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        deadLetters.add(new DeadLetter(event, reason, System.currentTimeMillis()));
    }

    /**
     * Number of events waiting for delivery.
     *
     * @return pending event count
     */
    public int pendingCount() {
        return queue.size();
    }

    /**
     * Snapshot of the dead letter queue.
     *
     * @return dead letters in arrival order
     */
    public List<DeadLetter> getDeadLetters() {
        return List.copyOf(deadLetters);
    }

    /**
     * Drops all pending events and dead letters. Used for tests.
     */
    public void clear() {
        queue.clear();
        deadLetters.clear();
    }

    /**
     * Undeliverable event with failure metadata.
     *
     * @param event the event
     * @param reason last failure description
     * @param deadLetteredAt time the event was given up on (epoch millis)
     */
    public record DeadLetter(Promoted event, String reason, long deadLetteredAt) {
    }
}
