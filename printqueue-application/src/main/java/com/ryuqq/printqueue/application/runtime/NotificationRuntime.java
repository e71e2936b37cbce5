package com.ryuqq.printqueue.application.runtime;

/**
 * Asynchronous promotion notification runtime.
 *
 * <p>Moves {@code Promoted} events from the notification bus to the chat platform,
 * outside the queue manager's critical section.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * 1. Dequeue events from NotificationBus (batch)
 * 2. For each Promoted event:
 *    a. Deliver via PromotionNotifier
 *    b. On failure:
 *       - attempts left → nack (re-queue with attempt + 1)
 *       - attempts exhausted → publish to dead letter queue
 * 3. Return (caller schedules the next cycle)
 * </pre>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>Delivery errors are caught per event and never reach the queue manager</li>
 *   <li>The queue order is never changed by a failed notification</li>
 * </ul>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public interface NotificationRuntime {

    /**
     * Executes a single pump cycle: dequeue, deliver, retry or dead-letter.
     *
     * <p>Returns after one batch has been handled, or immediately if the bus is empty.</p>
     *
     * @throws IllegalStateException if the runtime has been shut down
     */
    void pump();
}
