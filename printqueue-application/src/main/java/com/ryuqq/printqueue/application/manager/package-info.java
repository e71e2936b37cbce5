/**
 * 대기열 관리자 포트.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.printqueue.application.manager.QueueManager} - 직렬화된 대기열 변경 및 조회</li>
 *   <li>{@link com.ryuqq.printqueue.application.manager.QueueHealth} - 영속화 실패 누적에 따른 상태</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈의 {@code LockingQueueManager}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.printqueue.application.manager;
