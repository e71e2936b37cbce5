package com.ryuqq.printqueue.core.event;

import com.ryuqq.printqueue.core.model.ParticipantId;

/**
 * 새로운 참가자가 대기열 맨 앞으로 올라왔음을 알리는 이벤트.
 *
 * <p>맨 앞 엔트리 제거가 영속화된 후에만 발행됩니다. 어댑터는 이 이벤트를
 * 해당 참가자에게 메시지로 전달할 책임이 있습니다.</p>
 *
 * @param participant 새 맨 앞 참가자
 * @param occurredAt 발생 시각 (epoch millis)
 * @param attempt 전달 시도 횟수 (최초 발행 시 1)
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public record Promoted(ParticipantId participant, long occurredAt, int attempt) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException participant가 null이거나 attempt가 1 미만인 경우
     */
    public Promoted {
        if (participant == null) {
            throw new IllegalArgumentException("participant cannot be null");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1 (current: " + attempt + ")");
        }
    }

    /**
     * 현재 시각으로 최초 이벤트 생성.
     *
     * @param participant 새 맨 앞 참가자
     * @return Promoted 인스턴스 (attempt=1)
     */
    public static Promoted now(ParticipantId participant) {
        return new Promoted(participant, System.currentTimeMillis(), 1);
    }

    /**
     * 재시도용 이벤트 생성 (attempt + 1).
     *
     * @return 시도 횟수가 증가한 새 인스턴스
     */
    public Promoted nextAttempt() {
        return new Promoted(participant, occurredAt, attempt + 1);
    }
}
