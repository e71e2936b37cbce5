package com.ryuqq.printqueue.core.spi;

import com.ryuqq.printqueue.core.waitlist.WaitlistSnapshot;

import java.util.Optional;

/**
 * Durable storage SPI for the persisted waitlist snapshot.
 *
 * <p>The snapshot is the ordered list of participant identities, one entry per occupied slot,
 * front first, together with the self-chain state the admission rules depend on. It is owned exclusively by the queue manager: no other component reads or
 * writes it.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Load the snapshot once at startup</li>
 *   <li>Durably replace the snapshot after every successful mutation</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic replace: a crash during {@link #save(WaitlistSnapshot)} leaves the previous snapshot intact</li>
 *   <li>Durability: {@link #save(WaitlistSnapshot)} returns only after the data reached stable storage</li>
 *   <li>Lossless: {@code load()} after {@code save(s)} yields exactly {@code s}</li>
 * </ul>
 *
 * <p>Callers serialize access; implementations need not be thread-safe beyond visibility.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public interface SnapshotStore {

    /**
     * Loads the persisted snapshot.
     *
     * @return the snapshot, or empty if none has ever been written
     * @throws com.ryuqq.printqueue.core.exception.MalformedSnapshotException if the snapshot exists but cannot be decoded
     * @throws com.ryuqq.printqueue.core.exception.SnapshotPersistenceException if the snapshot cannot be read
     */
    Optional<WaitlistSnapshot> load();

    /**
     * Durably replaces the snapshot.
     *
     * @param snapshot ordered participant identities, front first (may be empty), and the self-chain state
     * @throws IllegalArgumentException if snapshot is null
     * @throws com.ryuqq.printqueue.core.exception.SnapshotPersistenceException if the write did not durably complete
     */
    void save(WaitlistSnapshot snapshot);

    /**
     * Whether saved snapshots survive a process restart.
     *
     * @return true for durable media, false for in-memory stores
     */
    boolean isDurable();
}
