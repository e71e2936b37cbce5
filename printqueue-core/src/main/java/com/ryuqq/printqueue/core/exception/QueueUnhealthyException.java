package com.ryuqq.printqueue.core.exception;

/**
 * 영속화 실패가 누적되어 대기열 관리자가 변경을 거부하는 상태.
 *
 * <p>디스크와 메모리 상태가 어긋날 위험이 있으므로, 관리자를 다시 시작해
 * 스냅샷에서 복원하기 전까지 모든 변경 요청이 이 예외로 거절됩니다. 조회는 계속 가능합니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class QueueUnhealthyException extends IllegalStateException {

    public QueueUnhealthyException(String message) {
        super(message);
    }

    public QueueUnhealthyException(String message, Throwable cause) {
        super(message, cause);
    }
}
