package com.ryuqq.printqueue.core.exception;

/**
 * 영속화된 스냅샷이 존재하지만 해석할 수 없는 경우.
 *
 * <p>시작 시점의 치명적 오류입니다. 손상된 사용자 상태를 조용히 버리지 않도록
 * 대기열 관리자는 생성되지 않습니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class MalformedSnapshotException extends RuntimeException {

    private final int lineNumber;

    /**
     * 생성자.
     *
     * @param lineNumber 문제가 발견된 1-based 줄 번호
     * @param message 오류 메시지
     */
    public MalformedSnapshotException(int lineNumber, String message) {
        super("Malformed snapshot at line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param lineNumber 문제가 발견된 1-based 줄 번호
     * @param message 오류 메시지
     * @param cause 원인
     */
    public MalformedSnapshotException(int lineNumber, String message, Throwable cause) {
        super("Malformed snapshot at line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
