package com.ryuqq.printqueue.adapter.file;

import com.ryuqq.printqueue.core.exception.SnapshotPersistenceException;
import com.ryuqq.printqueue.core.spi.SnapshotStore;
import com.ryuqq.printqueue.core.waitlist.WaitlistSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * File-backed implementation of {@link SnapshotStore}.
 *
 * <p>The snapshot is stored in the {@link LineSnapshotCodec} format.</p>
 *
 * <p><strong>Write sequence (crash-safe replace):</strong></p>
 * <ol>
 *   <li>Write the encoded snapshot to a temp file in the same directory</li>
 *   <li>{@code FileChannel.force(true)} the temp file</li>
 *   <li>Rename it over the snapshot file with {@code ATOMIC_MOVE}</li>
 *   <li>fsync the directory so the rename itself is durable (best effort)</li>
 * </ol>
 *
 * <p>A crash at any step leaves either the previous snapshot or the new one on disk, never a
 * partial file. A stale temp file from a crashed write is ignored by {@link #load()}.</p>
 *
 * <p>Not thread-safe; the queue manager serializes all access.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class FileSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path file;

    /**
     * Creates a store over the given snapshot file.
     *
     * <p>The file need not exist yet. Its parent directory is created on first save.</p>
     *
     * @param file snapshot file path
     * @throws IllegalArgumentException if file is null
     */
    public FileSnapshotStore(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        this.file = file.toAbsolutePath().normalize();
    }

    @Override
    public Optional<WaitlistSnapshot> load() {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            log.info("No snapshot at {}, starting with an empty queue", file);
            return Optional.empty();
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to read snapshot " + file, e);
        }

        WaitlistSnapshot snapshot = LineSnapshotCodec.decode(content);
        log.info("Loaded snapshot from {} ({} entries, self-chain open: {})",
            file, snapshot.entries().size(), snapshot.selfChainOpen());
        return Optional.of(snapshot);
    }

    @Override
    public void save(WaitlistSnapshot snapshot) {
        byte[] content = LineSnapshotCodec.encode(snapshot);
        Path directory = file.getParent();
        Path temp = null;

        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + file.getFileName() + ".", TEMP_SUFFIX);

            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            temp = null;
        } catch (IOException e) {
            SnapshotPersistenceException failure =
                new SnapshotPersistenceException("Failed to write snapshot " + file, e);
            deleteQuietly(temp, failure);
            throw failure;
        }

        syncDirectory(directory);
        log.debug("Saved snapshot to {} ({} entries)", file, snapshot.entries().size());
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    /**
     * Atomically replaces the snapshot with an empty queue.
     *
     * <p>Maintenance operation for resetting a queue file while the service is stopped.</p>
     *
     * @throws SnapshotPersistenceException if the write did not durably complete
     */
    public void clear() {
        save(WaitlistSnapshot.empty());
        log.info("Cleared snapshot {}", file);
    }

    public Path getFile() {
        return file;
    }

    private void deleteQuietly(Path temp, SnapshotPersistenceException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupFailure) {
            failure.addSuppressed(cleanupFailure);
        }
    }

    private void syncDirectory(Path directory) {
        // 일부 플랫폼은 디렉토리 채널 열기를 지원하지 않음
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("Directory fsync not supported for {}: {}", directory, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "FileSnapshotStore{file=" + file + "}";
    }
}
