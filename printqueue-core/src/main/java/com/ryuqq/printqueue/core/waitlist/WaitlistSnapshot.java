package com.ryuqq.printqueue.core.waitlist;

import com.ryuqq.printqueue.core.model.ParticipantId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 영속화되는 대기열 상태.
 *
 * <p>엔트리 순서만으로는 연속 슬롯 체인이 열려 있는지 알 수 없으므로(예: {@code [A, B]}에서 B가
 * 취소한 {@code [A]}는 체인이 닫혀 있음), 체인 상태를 함께 기록합니다.
 * 재시작 후 복원한 대기열은 마지막 커밋 직후와 같은 규칙으로 동작합니다.</p>
 *
 * <p><strong>불변식:</strong> 체인이 열려 있으면 엔트리가 하나 이상이고 모두 같은 참가자입니다.</p>
 *
 * @param entries 맨 앞부터 나열된 참가자 목록 (불변)
 * @param selfChainOpen 연속 슬롯 체인이 열려 있는지 여부
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public record WaitlistSnapshot(List<ParticipantId> entries, boolean selfChainOpen) {

    private static final WaitlistSnapshot EMPTY = new WaitlistSnapshot(List.of(), false);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException entries가 null이거나 null 엔트리를 포함하는 경우,
     *                                  또는 체인이 열려 있는데 엔트리가 한 참가자의 것이 아닌 경우
     */
    public WaitlistSnapshot {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        List<ParticipantId> copy = new ArrayList<>(entries.size());
        for (ParticipantId participant : entries) {
            if (participant == null) {
                throw new IllegalArgumentException("entries cannot contain null");
            }
            copy.add(participant);
        }
        if (selfChainOpen) {
            if (copy.isEmpty()) {
                throw new IllegalArgumentException("self-chain cannot be open on an empty waitlist");
            }
            ParticipantId owner = copy.get(0);
            for (ParticipantId participant : copy) {
                if (!participant.equals(owner)) {
                    throw new IllegalArgumentException(
                        "self-chain can only be open when every entry belongs to " + owner.getValue());
                }
            }
        }
        entries = Collections.unmodifiableList(copy);
    }

    public static WaitlistSnapshot empty() {
        return EMPTY;
    }

    /**
     * 체인이 닫힌 스냅샷 생성.
     *
     * @param entries 맨 앞부터 나열된 참가자 목록
     * @return WaitlistSnapshot
     */
    public static WaitlistSnapshot closed(List<ParticipantId> entries) {
        return new WaitlistSnapshot(entries, false);
    }

    /**
     * 체인이 열린 스냅샷 생성.
     *
     * @param entries 한 참가자의 엔트리 목록
     * @return WaitlistSnapshot
     * @throws IllegalArgumentException entries가 비었거나 여러 참가자를 포함하는 경우
     */
    public static WaitlistSnapshot withOpenChain(List<ParticipantId> entries) {
        return new WaitlistSnapshot(entries, true);
    }

    /**
     * 체인 소유자 조회.
     *
     * @return 체인이 열려 있으면 맨 앞 참가자, 아니면 null
     */
    public ParticipantId chainOwnerOrNull() {
        return selfChainOpen ? entries.get(0) : null;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
