package com.ryuqq.printqueue.adapter.runner;

/**
 * Notification Dispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: pump 주기 (기본 100ms)</li>
 *   <li>batchSize: 한 번에 dequeue할 이벤트 수 (기본 10)</li>
 *   <li>concurrency: 동시 전달 스레드 수 (기본 2)</li>
 *   <li>maxAttempts: 이벤트당 최대 전달 시도 횟수 (기본 5). 소진 시 DLQ로 이동</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중인 전달 대기 한도 (기본 10000ms)</li>
 * </ul>
 *
 * @author Print Queue Team
 * @since 1.0.0
 * @param pollingIntervalMs pump 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param concurrency 전달 스레드 수 (1 이상이어야 함)
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param shutdownTimeoutMs 종료 대기 한도 (밀리초, 양수여야 함)
 */
public record DispatcherConfig(
    long pollingIntervalMs,
    int batchSize,
    int concurrency,
    int maxAttempts,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollingIntervalMs=100ms, batchSize=10, concurrency=2, maxAttempts=5, shutdownTimeoutMs=10000ms</p>
     */
    public DispatcherConfig() {
        this(100, 10, 2, 5, 10000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DispatcherConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public DispatcherConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new DispatcherConfig(pollingIntervalMs, batchSize, concurrency, maxAttempts, shutdownTimeoutMs);
    }

    public DispatcherConfig withBatchSize(int batchSize) {
        return new DispatcherConfig(pollingIntervalMs, batchSize, concurrency, maxAttempts, shutdownTimeoutMs);
    }

    public DispatcherConfig withConcurrency(int concurrency) {
        return new DispatcherConfig(pollingIntervalMs, batchSize, concurrency, maxAttempts, shutdownTimeoutMs);
    }

    public DispatcherConfig withMaxAttempts(int maxAttempts) {
        return new DispatcherConfig(pollingIntervalMs, batchSize, concurrency, maxAttempts, shutdownTimeoutMs);
    }

    public DispatcherConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new DispatcherConfig(pollingIntervalMs, batchSize, concurrency, maxAttempts, shutdownTimeoutMs);
    }
}
