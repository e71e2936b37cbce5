package com.ryuqq.printqueue.application.manager;

import com.ryuqq.printqueue.core.model.ParticipantId;
import com.ryuqq.printqueue.core.model.Position;
import com.ryuqq.printqueue.core.model.Promotion;
import com.ryuqq.printqueue.core.outcome.QueueOutcome;

import java.util.List;

/**
 * 대기열 관리자 (Queue Manager).
 *
 * <p>대기열의 유일한 소유자로, 모든 요청을 직렬화하고 변경이 디스크에 영속화된 뒤에만
 * 성공을 보고합니다.</p>
 *
 * <p><strong>변경 연산의 보장:</strong></p>
 * <ul>
 *   <li>원자성: 규칙 평가, 영속화, 상태 반영이 하나의 임계 구역에서 수행됨</li>
 *   <li>내구성: {@link com.ryuqq.printqueue.core.outcome.Ok} 반환 시점에 새 상태가 저장소에 기록되어 있음</li>
 *   <li>거절: 규칙 위반은 {@link com.ryuqq.printqueue.core.outcome.Rejected}로 반환되며, 저장하지도 알리지도 않음</li>
 *   <li>롤백: 영속화 실패 시 메모리 상태는 변경 전으로 유지됨</li>
 * </ul>
 *
 * <p><strong>알림:</strong> 맨 앞 참가자가 바뀌면 커밋 후 알림 이벤트가 발행됩니다.
 * 알림 전달 실패는 이미 커밋된 변경에 영향을 주지 않습니다.</p>
 *
 * <p><strong>구현체:</strong> adapter-runner 모듈의 {@code LockingQueueManager}.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public interface QueueManager extends AutoCloseable {

    /**
     * 요청자를 대기열 맨 뒤에 추가.
     *
     * @param participant 요청자
     * @return Ok(1-based 위치) 또는 Rejected(BACK_TO_BACK, QUEUE_FULL)
     * @throws IllegalArgumentException participant가 null인 경우
     * @throws com.ryuqq.printqueue.core.exception.SnapshotPersistenceException 영속화 실패 (상태 롤백됨)
     * @throws com.ryuqq.printqueue.core.exception.QueueUnhealthyException 관리자가 비정상 상태인 경우
     */
    QueueOutcome<Position> addSelf(ParticipantId participant);

    /**
     * 맨 앞 엔트리를 제거하고 다음 참가자를 승격.
     *
     * @param participant 요청자 (맨 앞이어야 함)
     * @return Ok(Promotion) 또는 Rejected(QUEUE_EMPTY, NOT_AT_FRONT)
     * @throws IllegalArgumentException participant가 null인 경우
     * @throws com.ryuqq.printqueue.core.exception.SnapshotPersistenceException 영속화 실패 (상태 롤백됨)
     * @throws com.ryuqq.printqueue.core.exception.QueueUnhealthyException 관리자가 비정상 상태인 경우
     */
    QueueOutcome<Promotion> finishTurn(ParticipantId participant);

    /**
     * 요청자의 맨 앞이 아닌 엔트리 중 가장 앞의 것을 제거.
     *
     * @param participant 요청자
     * @return Ok(제거 전 위치) 또는 Rejected(AT_FRONT, NOT_FOUND)
     * @throws IllegalArgumentException participant가 null인 경우
     * @throws com.ryuqq.printqueue.core.exception.SnapshotPersistenceException 영속화 실패 (상태 롤백됨)
     * @throws com.ryuqq.printqueue.core.exception.QueueUnhealthyException 관리자가 비정상 상태인 경우
     */
    QueueOutcome<Position> cancelSelf(ParticipantId participant);

    /**
     * 현재 대기 순서 조회 (읽기 전용).
     *
     * <p>비정상 상태에서도 동작합니다.</p>
     *
     * @return 맨 앞부터 나열된 불변 리스트
     */
    List<ParticipantId> currentOrder();

    /**
     * 관리자 상태 조회.
     *
     * @return HEALTHY 또는 UNHEALTHY
     */
    QueueHealth health();

    /**
     * 영속화 리소스 해제.
     */
    @Override
    void close();
}
