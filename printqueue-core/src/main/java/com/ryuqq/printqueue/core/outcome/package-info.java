/**
 * Queue operation outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for waitlist and queue manager results.
 * Rule violations are values, not exceptions.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.printqueue.core.outcome.QueueOutcome} - Sealed interface (permits Ok, Rejected)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.printqueue.core.outcome.Ok} - Operation applied, carries its value</li>
 *   <li>{@link com.ryuqq.printqueue.core.outcome.Rejected} - Rule violation, carries a {@link com.ryuqq.printqueue.core.outcome.Rejection}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Print Queue Team
 */
package com.ryuqq.printqueue.core.outcome;
