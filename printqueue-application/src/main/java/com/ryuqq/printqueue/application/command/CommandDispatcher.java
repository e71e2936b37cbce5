package com.ryuqq.printqueue.application.command;

import com.ryuqq.printqueue.application.manager.QueueManager;
import com.ryuqq.printqueue.core.exception.QueueUnhealthyException;
import com.ryuqq.printqueue.core.exception.SnapshotPersistenceException;
import com.ryuqq.printqueue.core.model.ParticipantId;
import com.ryuqq.printqueue.core.model.Position;
import com.ryuqq.printqueue.core.model.Promotion;
import com.ryuqq.printqueue.core.outcome.QueueOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 채팅 메시지를 대기열 연산으로 변환하는 디스패처.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>{@link QueueCommand#parse(String)}로 명령 해석</li>
 *   <li>{@link QueueManager} 연산 호출</li>
 *   <li>결과를 {@link ReplyRenderer}로 메시지화</li>
 * </ol>
 *
 * <p>규칙 위반은 사용자 메시지로 변환되고, 영속화 실패나 비정상 상태는
 * ERROR로 기록한 뒤 일반적인 "일시적으로 사용할 수 없음" 응답을 반환합니다.</p>
 *
 * <p>맨 앞 참가자에 대한 알림은 이 클래스가 아니라 알림 버스를 통해 비동기로 전달됩니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final QueueManager manager;
    private final ReplyRenderer renderer;

    public CommandDispatcher(QueueManager manager) {
        this(manager, new ReplyRenderer());
    }

    /**
     * CommandDispatcher 생성.
     *
     * @param manager 대기열 관리자
     * @param renderer 메시지 생성기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CommandDispatcher(QueueManager manager, ReplyRenderer renderer) {
        if (manager == null) {
            throw new IllegalArgumentException("manager cannot be null");
        }
        if (renderer == null) {
            throw new IllegalArgumentException("renderer cannot be null");
        }
        this.manager = manager;
        this.renderer = renderer;
    }

    /**
     * 요청자의 메시지를 처리하고 응답을 생성.
     *
     * @param requester 메시지를 보낸 참가자
     * @param text 메시지 본문
     * @return 요청 채널에 게시할 응답
     * @throws IllegalArgumentException requester가 null인 경우
     */
    public Reply handle(ParticipantId requester, String text) {
        if (requester == null) {
            throw new IllegalArgumentException("requester cannot be null");
        }

        QueueCommand command = QueueCommand.parse(text);
        if (command == null) {
            log.debug("Unrecognized command from {}: {}", requester.getValue(), text);
            return new Reply(renderer.unrecognized());
        }

        try {
            return new Reply(execute(command, requester));
        } catch (SnapshotPersistenceException | QueueUnhealthyException e) {
            log.error("Command {} from {} failed: {}", command, requester.getValue(), e.getMessage(), e);
            return new Reply(renderer.unavailable());
        }
    }

    private String execute(QueueCommand command, ParticipantId requester) {
        switch (command) {
            case ADD: {
                QueueOutcome<Position> outcome = manager.addSelf(requester);
                return outcome.isOk()
                    ? renderer.added(requester, outcome.valueOrThrow())
                    : rejected(command, requester, outcome);
            }
            case DONE: {
                QueueOutcome<Promotion> outcome = manager.finishTurn(requester);
                return outcome.isOk()
                    ? renderer.finished(requester)
                    : rejected(command, requester, outcome);
            }
            case CANCEL: {
                QueueOutcome<Position> outcome = manager.cancelSelf(requester);
                return outcome.isOk()
                    ? renderer.cancelled(requester)
                    : rejected(command, requester, outcome);
            }
            case SHOW:
                return renderer.order(manager.currentOrder());
            default:
                throw new IllegalStateException("Unhandled command: " + command);
        }
    }

    private String rejected(QueueCommand command, ParticipantId requester, QueueOutcome<?> outcome) {
        log.debug("Command {} from {} rejected: {}", command, requester.getValue(), outcome.rejectionOrNull());
        return renderer.rejected(outcome.rejectionOrNull());
    }
}
