package com.ryuqq.printqueue.testkit.fake;

import com.ryuqq.printqueue.core.exception.SnapshotPersistenceException;
import com.ryuqq.printqueue.core.spi.SnapshotStore;
import com.ryuqq.printqueue.core.waitlist.WaitlistSnapshot;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link SnapshotStore} wrapper that injects write failures and stalls.
 *
 * <p>Used to verify that the queue manager rolls back on a failed write and
 * turns unhealthy when a write never completes.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * FaultInjectingSnapshotStore store = new FaultInjectingSnapshotStore(new InMemorySnapshotStore());
 * store.failNextSaves(1);
 * // next save throws SnapshotPersistenceException
 *
 * store.blockSaves();
 * // saves hang until store.releaseSaves()
 * </pre>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class FaultInjectingSnapshotStore implements SnapshotStore {

    private final SnapshotStore delegate;
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final AtomicInteger saveAttempts = new AtomicInteger();
    private final AtomicInteger successfulSaves = new AtomicInteger();
    private volatile CountDownLatch gate;

    public FaultInjectingSnapshotStore(SnapshotStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public Optional<WaitlistSnapshot> load() {
        return delegate.load();
    }

    @Override
    public void save(WaitlistSnapshot snapshot) {
        saveAttempts.incrementAndGet();

        CountDownLatch current = gate;
        if (current != null) {
            try {
                current.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SnapshotPersistenceException("Injected stall interrupted", e);
            }
        }

        if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new SnapshotPersistenceException("Injected write failure");
        }

        delegate.save(snapshot);
        successfulSaves.incrementAndGet();
    }

    @Override
    public boolean isDurable() {
        return delegate.isDurable();
    }

    /**
     * Makes the next {@code count} saves throw {@link SnapshotPersistenceException}.
     *
     * @param count number of failing saves
     */
    public void failNextSaves(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative");
        }
        failuresRemaining.set(count);
    }

    /**
     * Makes subsequent saves block until {@link #releaseSaves()}.
     */
    public void blockSaves() {
        gate = new CountDownLatch(1);
    }

    /**
     * Unblocks saves stalled by {@link #blockSaves()}.
     */
    public void releaseSaves() {
        CountDownLatch current = gate;
        gate = null;
        if (current != null) {
            current.countDown();
        }
    }

    public int getSaveAttempts() {
        return saveAttempts.get();
    }

    public int getSuccessfulSaves() {
        return successfulSaves.get();
    }

    public SnapshotStore getDelegate() {
        return delegate;
    }
}
