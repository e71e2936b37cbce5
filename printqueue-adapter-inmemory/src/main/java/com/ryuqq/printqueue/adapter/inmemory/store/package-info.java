/**
 * Non-durable snapshot storage.
 *
 * <p>{@link com.ryuqq.printqueue.adapter.inmemory.store.InMemorySnapshotStore} backs the
 * service when no queue file is configured. The queue then lives only as long as the process.</p>
 *
 * @since 1.0.0
 * @author Print Queue Team
 */
package com.ryuqq.printqueue.adapter.inmemory.store;
