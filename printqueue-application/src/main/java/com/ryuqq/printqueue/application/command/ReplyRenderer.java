package com.ryuqq.printqueue.application.command;

import com.ryuqq.printqueue.core.model.ParticipantId;
import com.ryuqq.printqueue.core.model.Position;
import com.ryuqq.printqueue.core.outcome.Rejection;
import com.ryuqq.printqueue.core.waitlist.Waitlist;

import java.util.List;

/**
 * 사용자에게 보여줄 메시지 생성.
 *
 * <p>참가자는 채팅 멘션 문법 {@code <@ID>}로 표시합니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class ReplyRenderer {

    static final String UNRECOGNIZED = "unrecognized command. Your options are: add, cancel, done, and show";
    static final String UNAVAILABLE = "Sorry, the queue is temporarily unavailable. Please try again later";
    static final String EMPTY_QUEUE = "The queue is empty";

    public String added(ParticipantId participant, Position position) {
        return "Okay " + mention(participant) + ", I have added you to the queue (position " + position.value() + ")";
    }

    public String finished(ParticipantId participant) {
        return "Okay " + mention(participant) + ", you have been removed from the front of the queue";
    }

    public String cancelled(ParticipantId participant) {
        return "Okay " + mention(participant) + ", I have removed you from the queue";
    }

    /**
     * 알림 메시지: 맨 앞이 된 참가자에게 차례를 알림.
     *
     * @param participant 새 맨 앞 참가자
     * @return 알림 메시지
     */
    public String promoted(ParticipantId participant) {
        return mention(participant) + ", it's your turn! You are now at the front of the queue";
    }

    /**
     * 현재 순서를 번호 목록으로 표시.
     *
     * @param order 맨 앞부터 나열된 참가자
     * @return 목록 메시지
     */
    public String order(List<ParticipantId> order) {
        if (order.isEmpty()) {
            return EMPTY_QUEUE;
        }
        StringBuilder builder = new StringBuilder("Current queue:");
        for (int i = 0; i < order.size(); i++) {
            builder.append('\n').append(i + 1).append(". ").append(mention(order.get(i)));
            if (i == 0) {
                builder.append(" (printing)");
            }
        }
        return builder.toString();
    }

    public String rejected(Rejection rejection) {
        return switch (rejection) {
            case BACK_TO_BACK -> "You are already at the back of the queue; wait for someone else to join before adding yourself again";
            case QUEUE_FULL -> "You already hold " + Waitlist.MAX_SELF_CHAIN + " slots in a row; wait for someone else to join";
            case NOT_AT_FRONT -> "You cannot be done; you are not at the front of the line";
            case QUEUE_EMPTY -> "You cannot be done; the queue is empty";
            case AT_FRONT -> "You are at the front of the queue; say done when you are finished";
            case NOT_FOUND -> "You weren't in the queue to begin with";
        };
    }

    public String unrecognized() {
        return UNRECOGNIZED;
    }

    public String unavailable() {
        return UNAVAILABLE;
    }

    private static String mention(ParticipantId participant) {
        return "<@" + participant.getValue() + ">";
    }
}
