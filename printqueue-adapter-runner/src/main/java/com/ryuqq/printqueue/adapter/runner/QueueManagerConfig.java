package com.ryuqq.printqueue.adapter.runner;

/**
 * Queue Manager 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>persistTimeoutMs: 스냅샷 쓰기 대기 한도 (기본 5000ms). 초과 시 디스크 상태를 알 수 없으므로 UNHEALTHY로 전환</li>
 *   <li>maxConsecutivePersistFailures: 연속 쓰기 실패 허용 횟수 (기본 3). 도달 시 UNHEALTHY로 전환</li>
 *   <li>shutdownTimeoutMs: close() 시 진행 중인 쓰기 대기 한도 (기본 10000ms)</li>
 * </ul>
 *
 * @author Print Queue Team
 * @since 1.0.0
 * @param persistTimeoutMs 쓰기 대기 한도 (밀리초, 양수여야 함)
 * @param maxConsecutivePersistFailures 연속 실패 허용 횟수 (1 이상이어야 함)
 * @param shutdownTimeoutMs 종료 대기 한도 (밀리초, 양수여야 함)
 */
public record QueueManagerConfig(
    long persistTimeoutMs,
    int maxConsecutivePersistFailures,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: persistTimeoutMs=5000ms, maxConsecutivePersistFailures=3, shutdownTimeoutMs=10000ms</p>
     */
    public QueueManagerConfig() {
        this(5000, 3, 10000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueManagerConfig {
        if (persistTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "persistTimeoutMs must be positive (current: " + persistTimeoutMs + ")"
            );
        }
        if (maxConsecutivePersistFailures <= 0) {
            throw new IllegalArgumentException(
                "maxConsecutivePersistFailures must be positive (current: " + maxConsecutivePersistFailures + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * persistTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public QueueManagerConfig withPersistTimeoutMs(long persistTimeoutMs) {
        return new QueueManagerConfig(persistTimeoutMs, maxConsecutivePersistFailures, shutdownTimeoutMs);
    }

    /**
     * maxConsecutivePersistFailures만 변경한 새 인스턴스 생성.
     */
    public QueueManagerConfig withMaxConsecutivePersistFailures(int maxConsecutivePersistFailures) {
        return new QueueManagerConfig(persistTimeoutMs, maxConsecutivePersistFailures, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public QueueManagerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new QueueManagerConfig(persistTimeoutMs, maxConsecutivePersistFailures, shutdownTimeoutMs);
    }
}
