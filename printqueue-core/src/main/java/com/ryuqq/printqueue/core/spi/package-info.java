/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete functionality for the queue core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.printqueue.core.spi.SnapshotStore} - Durable waitlist snapshot (load at startup, replace on mutation)</li>
 *   <li>{@link com.ryuqq.printqueue.core.spi.NotificationBus} - Event queue between the queue manager and delivery</li>
 *   <li>{@link com.ryuqq.printqueue.core.spi.PromotionNotifier} - Message delivery to the promoted participant</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (printqueue-adapter-file, printqueue-adapter-inmemory, and the chat
 * integration) provide concrete implementations of these SPIs.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Print Queue Team
 */
package com.ryuqq.printqueue.core.spi;
