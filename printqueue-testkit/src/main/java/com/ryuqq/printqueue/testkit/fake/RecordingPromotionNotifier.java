package com.ryuqq.printqueue.testkit.fake;

import com.ryuqq.printqueue.core.event.Promoted;
import com.ryuqq.printqueue.core.model.ParticipantId;
import com.ryuqq.printqueue.core.spi.PromotionNotifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link PromotionNotifier} test double that records deliveries.
 *
 * <p>Can be told to fail a number of upcoming deliveries, or every delivery,
 * to exercise the dispatcher's retry and dead letter paths.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class RecordingPromotionNotifier implements PromotionNotifier {

    private final List<Promoted> delivered = new CopyOnWriteArrayList<>();
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private volatile boolean alwaysFail;

    @Override
    public void deliver(Promoted event) throws Exception {
        attempts.incrementAndGet();
        if (alwaysFail) {
            throw new IllegalStateException("delivery failed for " + event.participant());
        }
        if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("delivery failed for " + event.participant());
        }
        delivered.add(event);
    }

    /**
     * Makes the next {@code count} deliveries throw.
     *
     * @param count number of failing deliveries
     */
    public void failNext(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative");
        }
        failuresRemaining.set(count);
    }

    /**
     * Makes every delivery throw until reset.
     *
     * @param alwaysFail true to fail every delivery
     */
    public void setAlwaysFail(boolean alwaysFail) {
        this.alwaysFail = alwaysFail;
    }

    public List<Promoted> getDelivered() {
        return List.copyOf(delivered);
    }

    /**
     * Participants that received a notification, in delivery order.
     *
     * @return notified participants
     */
    public List<ParticipantId> getNotifiedParticipants() {
        List<ParticipantId> participants = new ArrayList<>();
        for (Promoted event : delivered) {
            participants.add(event.participant());
        }
        return participants;
    }

    public int getAttemptCount() {
        return attempts.get();
    }

    /**
     * Waits until at least {@code count} deliveries succeeded.
     *
     * @param count expected number of deliveries
     * @param timeout maximum wait
     * @param unit timeout unit
     * @return true if reached before the timeout
     */
    public boolean awaitDeliveries(int count, long timeout, TimeUnit unit) {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (delivered.size() < count) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }
}
