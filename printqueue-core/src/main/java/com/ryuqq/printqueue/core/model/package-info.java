/**
 * Core value objects package.
 *
 * <p>Immutable value types shared by the waitlist, the queue manager and the adapters.</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.printqueue.core.model.ParticipantId} - Opaque participant identity (e.g. a chat user ID)</li>
 *   <li>{@link com.ryuqq.printqueue.core.model.Position} - 1-based slot number, 1 = front</li>
 *   <li>{@link com.ryuqq.printqueue.core.model.Promotion} - Result of removing the front entry</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Print Queue Team
 */
package com.ryuqq.printqueue.core.model;
