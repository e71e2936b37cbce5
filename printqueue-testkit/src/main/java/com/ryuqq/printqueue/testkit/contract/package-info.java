/**
 * Reusable contract tests for SPI implementations.
 *
 * <p>Adapters extend these abstract classes from their own test sources so that every
 * implementation is held to the same behavior.</p>
 *
 * @since 1.0.0
 * @author Print Queue Team
 */
package com.ryuqq.printqueue.testkit.contract;
