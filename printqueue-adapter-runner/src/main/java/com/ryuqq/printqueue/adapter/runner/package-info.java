/**
 * Runner 구현체 패키지.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.printqueue.adapter.runner.LockingQueueManager} - 직렬화 + 영속화 후 커밋하는 대기열 관리자</li>
 *   <li>{@link com.ryuqq.printqueue.adapter.runner.NotificationDispatcher} - 승격 알림 비동기 전달 (재시도, DLQ)</li>
 *   <li>{@link com.ryuqq.printqueue.adapter.runner.PrintQueueBootstrap} - 시작 옵션에 따른 조립</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Print Queue Team
 */
package com.ryuqq.printqueue.adapter.runner;
