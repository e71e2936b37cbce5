package com.ryuqq.printqueue.core.outcome;

/**
 * 대기열 연산 결과.
 *
 * <p>QueueOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 연산이 적용됨 (값 포함)</li>
 *   <li>{@link Rejected}: 규칙 위반으로 거절됨 (상태 변경 없음)</li>
 * </ul>
 *
 * <p>규칙 위반은 예외가 아니라 값으로 반환됩니다. 영속화 실패와 같은
 * 인프라 오류만 예외로 전파됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * QueueOutcome&lt;Position&gt; outcome = waitlist.add(participant);
 * if (outcome instanceof Ok&lt;Position&gt; ok) {
 *     Position position = ok.value();
 * } else {
 *     Rejection reason = outcome.rejectionOrNull();
 * }
 * </pre>
 *
 * @param <T> 성공 시 값 타입
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public sealed interface QueueOutcome<T> permits Ok, Rejected {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 거절인지 확인.
     *
     * @return 거절 여부
     */
    default boolean isRejected() {
        return this instanceof Rejected;
    }

    /**
     * 성공 값 조회.
     *
     * @return 성공 값
     * @throws IllegalStateException 거절된 결과인 경우
     */
    default T valueOrThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new IllegalStateException("Outcome was rejected: " + rejectionOrNull());
    }

    /**
     * 거절 사유 조회.
     *
     * @return 거절 사유 또는 null (성공한 경우)
     */
    default Rejection rejectionOrNull() {
        if (this instanceof Rejected<T> rejected) {
            return rejected.reason();
        }
        return null;
    }
}
