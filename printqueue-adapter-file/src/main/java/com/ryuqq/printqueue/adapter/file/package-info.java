/**
 * File adapter package.
 *
 * <p>Persists the waitlist as a line-delimited text file that survives process restarts.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.printqueue.adapter.file.LineSnapshotCodec} - strict line-delimited encoding</li>
 *   <li>{@link com.ryuqq.printqueue.adapter.file.FileSnapshotStore} - crash-safe replace via temp file and atomic rename</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Print Queue Team
 */
package com.ryuqq.printqueue.adapter.file;
