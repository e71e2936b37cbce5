package com.ryuqq.printqueue.adapter.inmemory.store;

import com.ryuqq.printqueue.core.spi.SnapshotStore;
import com.ryuqq.printqueue.core.waitlist.WaitlistSnapshot;

import java.util.Optional;

/**
 * In-memory implementation of {@link SnapshotStore}.
 *
 * <p>Holds the last saved snapshot in a volatile field. Used when the service runs without a
 * queue file and by tests. Nothing survives a restart.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private volatile WaitlistSnapshot snapshot;

    /**
     * Creates a store that has never been written.
     */
    public InMemorySnapshotStore() {
        this.snapshot = null;
    }

    /**
     * Creates a store preloaded with a snapshot. Used for tests.
     *
     * @param initial initial snapshot
     * @throws IllegalArgumentException if initial is null
     */
    public InMemorySnapshotStore(WaitlistSnapshot initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        this.snapshot = initial;
    }

    @Override
    public Optional<WaitlistSnapshot> load() {
        return Optional.ofNullable(snapshot);
    }

    @Override
    public void save(WaitlistSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        this.snapshot = snapshot;
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    /**
     * Forgets the stored snapshot.
     */
    public void clear() {
        this.snapshot = null;
    }
}
