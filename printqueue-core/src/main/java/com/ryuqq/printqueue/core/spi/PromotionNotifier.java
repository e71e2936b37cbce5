package com.ryuqq.printqueue.core.spi;

import com.ryuqq.printqueue.core.event.Promoted;

/**
 * Outbound notification SPI implemented by the chat platform adapter.
 *
 * <p>Delivers a message to the participant who just reached the front of the queue.
 * Implementations may block on network I/O and may throw; failures are retried by the
 * notification dispatcher and never affect committed queue state.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PromotionNotifier {

    /**
     * Delivers the notification.
     *
     * @param event the promotion event
     * @throws Exception if delivery failed and should be retried
     */
    void deliver(Promoted event) throws Exception;
}
