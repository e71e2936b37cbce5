package com.ryuqq.printqueue.application.manager;

/**
 * 대기열 관리자 상태.
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public enum QueueHealth {

    /**
     * 정상: 모든 연산 허용.
     */
    HEALTHY,

    /**
     * 비정상: 디스크 상태를 신뢰할 수 없어 변경 연산을 거부하고 조회만 허용.
     *
     * <p>재시작으로만 복구됩니다.</p>
     */
    UNHEALTHY
}
