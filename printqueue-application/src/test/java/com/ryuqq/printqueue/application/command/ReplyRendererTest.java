package com.ryuqq.printqueue.application.command;

import com.ryuqq.printqueue.core.model.ParticipantId;
import com.ryuqq.printqueue.core.model.Position;
import com.ryuqq.printqueue.core.outcome.Rejection;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ReplyRenderer 테스트.
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
class ReplyRendererTest {

    private static final ParticipantId ALICE = ParticipantId.of("UA8RXUPSP");
    private static final ParticipantId BOB = ParticipantId.of("UNB2LMZRP");

    private final ReplyRenderer renderer = new ReplyRenderer();

    @Test
    void added_위치_포함() {
        assertThat(renderer.added(ALICE, new Position(3)))
            .isEqualTo("Okay <@UA8RXUPSP>, I have added you to the queue (position 3)");
    }

    @Test
    void finished_cancelled_메시지() {
        assertThat(renderer.finished(ALICE))
            .isEqualTo("Okay <@UA8RXUPSP>, you have been removed from the front of the queue");
        assertThat(renderer.cancelled(ALICE))
            .isEqualTo("Okay <@UA8RXUPSP>, I have removed you from the queue");
    }

    @Test
    void promoted_멘션() {
        assertThat(renderer.promoted(BOB))
            .isEqualTo("<@UNB2LMZRP>, it's your turn! You are now at the front of the queue");
    }

    @Test
    void order_빈_대기열() {
        assertThat(renderer.order(List.of())).isEqualTo("The queue is empty");
    }

    @Test
    void order_번호_목록() {
        assertThat(renderer.order(List.of(ALICE, BOB, ALICE)))
            .isEqualTo("Current queue:\n1. <@UA8RXUPSP> (printing)\n2. <@UNB2LMZRP>\n3. <@UA8RXUPSP>");
    }

    @Test
    void rejected_모든_사유에_고유_메시지() {
        List<String> messages = Arrays.stream(Rejection.values()).map(renderer::rejected).toList();

        assertThat(messages).doesNotHaveDuplicates().allMatch(m -> !m.isBlank());
        assertThat(renderer.rejected(Rejection.NOT_AT_FRONT))
            .isEqualTo("You cannot be done; you are not at the front of the line");
    }

    @Test
    void unrecognized_명령_안내() {
        assertThat(renderer.unrecognized())
            .isEqualTo("unrecognized command. Your options are: add, cancel, done, and show");
    }
}
