package com.ryuqq.printqueue.core.outcome;

/**
 * 대기열 규칙 위반 사유.
 *
 * <p>모두 사용자에게 그대로 전달되는 예상된 거절이며, 오류로 기록하지 않습니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public enum Rejection {

    /**
     * 마지막 엔트리가 같은 참가자 (자기 자신 바로 뒤에 줄 설 수 없음).
     */
    BACK_TO_BACK("QUEUE-001"),

    /**
     * 빈 대기열에서 시작한 연속 슬롯이 이미 최대치.
     */
    QUEUE_FULL("QUEUE-002"),

    /**
     * 맨 앞 엔트리가 다른 참가자의 것.
     */
    NOT_AT_FRONT("QUEUE-003"),

    /**
     * 대기열이 비어 있음.
     */
    QUEUE_EMPTY("QUEUE-004"),

    /**
     * 취소하려는 유일한 엔트리가 맨 앞 (done으로 떠나야 함).
     */
    AT_FRONT("QUEUE-005"),

    /**
     * 참가자의 엔트리가 없음.
     */
    NOT_FOUND("QUEUE-006");

    private final String code;

    Rejection(String code) {
        this.code = code;
    }

    /**
     * 안정적인 오류 코드 조회.
     *
     * @return 오류 코드 (예: QUEUE-001)
     */
    public String code() {
        return code;
    }
}
