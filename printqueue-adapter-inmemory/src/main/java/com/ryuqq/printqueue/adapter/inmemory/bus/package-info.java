/**
 * In-memory notification bus.
 *
 * @since 1.0.0
 * @author Print Queue Team
 */
package com.ryuqq.printqueue.adapter.inmemory.bus;
