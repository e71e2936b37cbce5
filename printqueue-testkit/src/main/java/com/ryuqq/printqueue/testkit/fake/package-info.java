/**
 * Test doubles for fault injection and delivery recording.
 *
 * @since 1.0.0
 * @author Print Queue Team
 */
package com.ryuqq.printqueue.testkit.fake;
