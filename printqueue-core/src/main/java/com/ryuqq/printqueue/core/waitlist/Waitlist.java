package com.ryuqq.printqueue.core.waitlist;

import com.ryuqq.printqueue.core.model.ParticipantId;
import com.ryuqq.printqueue.core.model.Position;
import com.ryuqq.printqueue.core.model.Promotion;
import com.ryuqq.printqueue.core.outcome.Ok;
import com.ryuqq.printqueue.core.outcome.QueueOutcome;
import com.ryuqq.printqueue.core.outcome.Rejected;
import com.ryuqq.printqueue.core.outcome.Rejection;

import java.util.ArrayList;
import java.util.List;

/**
 * 단일 공유 자원(예: 3D 프린터)을 기다리는 순서 있는 대기열.
 *
 * <p>인덱스 0의 엔트리가 현재 자원을 사용 중인 맨 앞(front)입니다.
 * 이 클래스는 입장/퇴장 규칙만 담당하며, 영속화나 동시성 제어는 알지 못합니다.</p>
 *
 * <p><strong>입장 규칙 (add):</strong></p>
 * <ul>
 *   <li>빈 대기열: 항상 허용하며, 해당 참가자의 "연속 슬롯 체인"이 시작됨</li>
 *   <li>체인이 열려 있고 같은 참가자: 최대 {@value #MAX_SELF_CHAIN}개까지 허용, 초과 시 QUEUE_FULL</li>
 *   <li>마지막 엔트리가 같은 참가자: BACK_TO_BACK</li>
 *   <li>그 외: 맨 뒤에 추가</li>
 * </ul>
 *
 * <p><strong>연속 슬롯 체인:</strong> 빈 대기열에 처음 들어온 참가자 외에 다른 참가자가
 * 한 번이라도 추가되면 체인은 닫히고, 대기열이 다시 빌 때까지 열리지 않습니다.
 * 대기열이 비었다가 다시 채워질 때마다 허용량이 초기화됩니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 스레드 안전하지 않음. 동시 접근은 호출자가 직렬화해야 합니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public final class Waitlist {

    /**
     * 빈 대기열에서 시작한 참가자가 연속으로 가질 수 있는 최대 슬롯 수.
     */
    public static final int MAX_SELF_CHAIN = 3;

    private final List<ParticipantId> entries;

    /**
     * 현재 체인을 연 참가자. 체인이 닫혔거나 대기열이 비어 있으면 null.
     */
    private ParticipantId chainOwner;

    private Waitlist(List<ParticipantId> entries, ParticipantId chainOwner) {
        this.entries = entries;
        this.chainOwner = chainOwner;
    }

    /**
     * 빈 대기열 생성.
     *
     * @return 빈 Waitlist
     */
    public static Waitlist empty() {
        return new Waitlist(new ArrayList<>(), null);
    }

    /**
     * 영속화된 스냅샷으로부터 대기열 복원 (체인 상태 포함).
     *
     * @param snapshot 영속화된 상태
     * @return 복원된 Waitlist
     * @throws IllegalArgumentException snapshot이 null인 경우
     */
    public static Waitlist restore(WaitlistSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        return new Waitlist(new ArrayList<>(snapshot.entries()), snapshot.chainOwnerOrNull());
    }

    /**
     * 대기열 맨 뒤에 참가자 추가.
     *
     * @param participant 참가자
     * @return Ok(1-based 위치) 또는 Rejected(BACK_TO_BACK, QUEUE_FULL)
     * @throws IllegalArgumentException participant가 null인 경우
     */
    public QueueOutcome<Position> add(ParticipantId participant) {
        requireParticipant(participant);

        if (entries.isEmpty()) {
            chainOwner = participant;
            return append(participant);
        }

        if (participant.equals(chainOwner)) {
            if (entries.size() >= MAX_SELF_CHAIN) {
                return Rejected.because(Rejection.QUEUE_FULL);
            }
            return append(participant);
        }

        if (participant.equals(last())) {
            return Rejected.because(Rejection.BACK_TO_BACK);
        }

        // 다른 참가자가 끼어들면 체인은 닫힘
        chainOwner = null;
        return append(participant);
    }

    /**
     * 맨 앞 엔트리 제거 (자원 사용 완료).
     *
     * @param participant 사용을 마친 참가자
     * @return Ok(Promotion) 또는 Rejected(QUEUE_EMPTY, NOT_AT_FRONT)
     * @throws IllegalArgumentException participant가 null인 경우
     */
    public QueueOutcome<Promotion> removeFront(ParticipantId participant) {
        requireParticipant(participant);

        if (entries.isEmpty()) {
            return Rejected.because(Rejection.QUEUE_EMPTY);
        }
        if (!entries.get(0).equals(participant)) {
            return Rejected.because(Rejection.NOT_AT_FRONT);
        }

        entries.remove(0);
        if (entries.isEmpty()) {
            chainOwner = null;
            return Ok.of(Promotion.none(participant));
        }
        return Ok.of(Promotion.to(participant, entries.get(0)));
    }

    /**
     * 맨 앞이 아닌 엔트리 중 가장 앞에 있는 참가자 엔트리 제거 (대기 취소).
     *
     * <p>맨 앞 엔트리는 취소할 수 없으며, 맨 앞 참가자가 바뀌지 않으므로 알림 대상도 없습니다.</p>
     *
     * @param participant 취소하는 참가자
     * @return Ok(제거 전 위치) 또는 Rejected(AT_FRONT, NOT_FOUND)
     * @throws IllegalArgumentException participant가 null인 경우
     */
    public QueueOutcome<Position> removeSelf(ParticipantId participant) {
        requireParticipant(participant);

        for (int i = 1; i < entries.size(); i++) {
            if (entries.get(i).equals(participant)) {
                entries.remove(i);
                return Ok.of(Position.fromIndex(i));
            }
        }

        if (!entries.isEmpty() && entries.get(0).equals(participant)) {
            return Rejected.because(Rejection.AT_FRONT);
        }
        return Rejected.because(Rejection.NOT_FOUND);
    }

    /**
     * 현재 순서의 읽기 전용 스냅샷.
     *
     * @return 맨 앞부터 나열된 불변 리스트
     */
    public List<ParticipantId> snapshot() {
        return List.copyOf(entries);
    }

    /**
     * 영속화할 상태 생성 (체인 상태 포함).
     *
     * @return 현재 순서와 체인 상태
     */
    public WaitlistSnapshot toSnapshot() {
        return new WaitlistSnapshot(entries, chainOwner != null);
    }

    /**
     * 독립적인 복사본 생성 (체인 상태 포함).
     *
     * @return 복사된 Waitlist
     */
    public Waitlist copy() {
        return new Waitlist(new ArrayList<>(entries), chainOwner);
    }

    /**
     * 맨 앞 참가자 조회.
     *
     * @return 맨 앞 참가자 또는 null (빈 대기열)
     */
    public ParticipantId frontOrNull() {
        return entries.isEmpty() ? null : entries.get(0);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 연속 슬롯 체인이 열려 있는지 확인.
     *
     * @return 체인이 열려 있으면 true
     */
    public boolean isSelfChainOpen() {
        return chainOwner != null;
    }

    private QueueOutcome<Position> append(ParticipantId participant) {
        entries.add(participant);
        return Ok.of(new Position(entries.size()));
    }

    private ParticipantId last() {
        return entries.get(entries.size() - 1);
    }

    private static void requireParticipant(ParticipantId participant) {
        if (participant == null) {
            throw new IllegalArgumentException("participant cannot be null");
        }
    }

    @Override
    public String toString() {
        return "Waitlist{entries=" + entries + ", selfChainOpen=" + isSelfChainOpen() + "}";
    }
}
