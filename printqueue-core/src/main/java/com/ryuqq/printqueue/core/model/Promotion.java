package com.ryuqq.printqueue.core.model;

/**
 * 맨 앞 엔트리 제거 결과.
 *
 * <p>자원 사용을 마친 참가자와, 제거 후 새로 맨 앞이 된 참가자를 담습니다.
 * 대기열에 남은 엔트리가 없으면 새 맨 앞 참가자는 null입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Promotion promotion = ...;
 * if (promotion.hasNewFront()) {
 *     notify(promotion.getNewFrontOrNull());
 * }
 * </pre>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public final class Promotion {

    private final ParticipantId finished;
    private final ParticipantId newFrontOrNull;

    private Promotion(ParticipantId finished, ParticipantId newFrontOrNull) {
        if (finished == null) {
            throw new IllegalArgumentException("finished cannot be null");
        }
        this.finished = finished;
        this.newFrontOrNull = newFrontOrNull;
    }

    /**
     * 새 맨 앞 참가자가 생긴 경우의 결과 생성.
     *
     * @param finished 사용을 마친 참가자
     * @param newFront 새 맨 앞 참가자
     * @return Promotion 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static Promotion to(ParticipantId finished, ParticipantId newFront) {
        if (newFront == null) {
            throw new IllegalArgumentException("newFront cannot be null");
        }
        return new Promotion(finished, newFront);
    }

    /**
     * 대기열이 비게 된 경우의 결과 생성.
     *
     * @param finished 사용을 마친 참가자
     * @return Promotion 인스턴스 (새 맨 앞 참가자 없음)
     * @throws IllegalArgumentException finished가 null인 경우
     */
    public static Promotion none(ParticipantId finished) {
        return new Promotion(finished, null);
    }

    public ParticipantId getFinished() {
        return finished;
    }

    /**
     * 새 맨 앞 참가자 조회.
     *
     * @return 새 맨 앞 참가자 또는 null (대기열이 빈 경우)
     */
    public ParticipantId getNewFrontOrNull() {
        return newFrontOrNull;
    }

    public boolean hasNewFront() {
        return newFrontOrNull != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Promotion that = (Promotion) o;
        return finished.equals(that.finished)
            && (newFrontOrNull == null ? that.newFrontOrNull == null : newFrontOrNull.equals(that.newFrontOrNull));
    }

    @Override
    public int hashCode() {
        return 31 * finished.hashCode() + (newFrontOrNull == null ? 0 : newFrontOrNull.hashCode());
    }

    @Override
    public String toString() {
        return "Promotion{finished=" + finished + ", newFront=" + newFrontOrNull + "}";
    }
}
