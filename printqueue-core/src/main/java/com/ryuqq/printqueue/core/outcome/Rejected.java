package com.ryuqq.printqueue.core.outcome;

/**
 * 거절 결과.
 *
 * <p>대기열 규칙 위반으로 연산이 적용되지 않았음을 나타냅니다.
 * 거절된 연산은 상태를 바꾸지 않고, 영속화하지 않으며, 알림도 발생시키지 않습니다.</p>
 *
 * @param reason 거절 사유
 * @param <T> 성공 시 값 타입 (거절 결과에는 값이 없음)
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public record Rejected<T>(Rejection reason) implements QueueOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public Rejected {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
    }

    /**
     * 거절 결과 생성.
     *
     * @param reason 거절 사유
     * @param <T> 성공 시 값 타입
     * @return Rejected 인스턴스
     */
    public static <T> Rejected<T> because(Rejection reason) {
        return new Rejected<>(reason);
    }
}
