package com.ryuqq.printqueue.core.spi;

import com.ryuqq.printqueue.core.event.Promoted;

import java.util.List;

/**
 * Event queue SPI decoupling notification delivery from queue mutations.
 *
 * <p>The queue manager publishes {@link Promoted} events after a mutation is durably committed;
 * the notification dispatcher consumes them and hands them to the chat adapter.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: publish and dequeue are called from different threads</li>
 *   <li>Non-blocking publish: must never stall the queue manager</li>
 *   <li>FIFO: events are dequeued in publish order</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * List&lt;Promoted&gt; batch = bus.dequeue(10);
 * for (Promoted event : batch) {
 *     try {
 *         notifier.deliver(event);
 *     } catch (Exception e) {
 *         bus.nack(event);
 *     }
 * }
 * </pre>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public interface NotificationBus {

    /**
     * Publishes an event for asynchronous delivery.
     *
     * @param event the event
     * @throws IllegalArgumentException if event is null
     */
    void publish(Promoted event);

    /**
     * Removes and returns up to {@code batchSize} pending events.
     *
     * @param batchSize maximum number of events
     * @return pending events in publish order (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<Promoted> dequeue(int batchSize);

    /**
     * Returns a failed event to the queue with its attempt count incremented.
     *
     * @param event the event whose delivery failed
     * @throws IllegalArgumentException if event is null
     */
    void nack(Promoted event);

    /**
     * Moves an event that can no longer be delivered to the dead letter queue.
     *
     * @param event the undeliverable event
     * @param reason failure description
     * @throws IllegalArgumentException if event is null or reason is blank
     */
    void publishToDeadLetter(Promoted event, String reason);
}
