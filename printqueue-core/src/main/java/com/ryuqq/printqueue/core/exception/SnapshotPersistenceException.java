package com.ryuqq.printqueue.core.exception;

/**
 * 스냅샷을 영속 저장소에 쓰거나 읽지 못한 경우.
 *
 * <p>이 예외로 끝난 변경은 성공으로 보고되지 않으며, 메모리 상태는 변경 전으로 유지됩니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class SnapshotPersistenceException extends RuntimeException {

    public SnapshotPersistenceException(String message) {
        super(message);
    }

    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
