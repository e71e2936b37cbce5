package com.ryuqq.printqueue.adapter.runner;

import com.ryuqq.printqueue.application.command.Reply;
import com.ryuqq.printqueue.core.exception.MalformedSnapshotException;
import com.ryuqq.printqueue.core.model.ParticipantId;
import com.ryuqq.printqueue.testkit.fake.RecordingPromotionNotifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 조립된 서비스 전체 흐름 테스트.
 *
 * <p>채팅 메시지 처리부터 스냅샷 저장, 승격 알림 전달, 재시작 복원까지 검증합니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
@DisplayName("PrintQueueBootstrap 통합 테스트")
class PrintQueueBootstrapTest {

    private static final ParticipantId ALICE = ParticipantId.of("UA8RXUPSP");
    private static final ParticipantId BOB = ParticipantId.of("UNB2LMZRP");

    private static final DispatcherConfig FAST_DISPATCH = new DispatcherConfig()
        .withPollingIntervalMs(10)
        .withMaxAttempts(2)
        .withShutdownTimeoutMs(1000);

    @TempDir
    Path dir;

    @Test
    @DisplayName("명령이 처리되고 done 이후 다음 참가자에게 알림이 전달된다")
    void 명령_흐름_및_승격_알림() {
        // given
        Path file = dir.resolve("queue.txt");
        RecordingPromotionNotifier notifier = new RecordingPromotionNotifier();

        try (PrintQueueApplication app = PrintQueueBootstrap.start(durable(file), notifier, FAST_DISPATCH)) {
            // when
            Reply added = app.commands().handle(ALICE, "<@UBOT00001> add");
            app.commands().handle(BOB, "add");
            Reply shown = app.commands().handle(ALICE, "show");
            Reply done = app.commands().handle(ALICE, "done");

            // then
            assertThat(added.text()).isEqualTo("Okay <@UA8RXUPSP>, I have added you to the queue (position 1)");
            assertThat(shown.text()).isEqualTo("Current queue:\n1. <@UA8RXUPSP> (printing)\n2. <@UNB2LMZRP>");
            assertThat(done.text()).isEqualTo("Okay <@UA8RXUPSP>, you have been removed from the front of the queue");

            assertThat(notifier.awaitDeliveries(1, 5, TimeUnit.SECONDS)).isTrue();
            assertThat(notifier.getNotifiedParticipants()).containsExactly(BOB);
            assertThat(app.manager().currentOrder()).containsExactly(BOB);
        }
    }

    @Test
    @DisplayName("재시작하면 파일에 저장된 순서가 복원된다")
    void 재시작_복원() {
        // given
        Path file = dir.resolve("queue.txt");
        try (PrintQueueApplication first = PrintQueueBootstrap.start(durable(file))) {
            first.commands().handle(ALICE, "add");
            first.commands().handle(BOB, "add");
        }

        // when
        try (PrintQueueApplication second = PrintQueueBootstrap.start(durable(file))) {
            // then
            assertThat(second.manager().currentOrder()).containsExactly(ALICE, BOB);
            assertThat(second.commands().handle(BOB, "done").text())
                .isEqualTo("You cannot be done; you are not at the front of the line");
        }
    }

    @Test
    @DisplayName("손상된 스냅샷 파일이면 시작을 거부한다")
    void 손상된_파일_시작_거부() throws IOException {
        // given
        Path file = dir.resolve("queue.txt");
        Files.write(file, "UA8RXUPSP\n\nUNB2LMZRP\n".getBytes(StandardCharsets.UTF_8));

        // when & then
        assertThatThrownBy(() -> PrintQueueBootstrap.start(durable(file)))
            .isInstanceOf(MalformedSnapshotException.class)
            .hasMessageContaining("line 2");
    }

    @Test
    @DisplayName("--clear-queue는 기존 스냅샷을 비우고 시작한다")
    void clear_queue_초기화() throws IOException {
        // given
        Path file = dir.resolve("queue.txt");
        Files.write(file, "UA8RXUPSP\nUNB2LMZRP\n".getBytes(StandardCharsets.UTF_8));
        LaunchOptions options = LaunchOptions.parse(new String[]{"--queue-file", file.toString(), "--clear-queue"});

        // when
        try (PrintQueueApplication app = PrintQueueBootstrap.start(options)) {
            // then
            assertThat(app.manager().currentOrder()).isEmpty();
            assertThat(Files.size(file)).isZero();
        }
    }

    @Test
    @DisplayName("파일 없이 시작하면 in-memory 모드로 동작한다")
    void in_memory_모드() {
        // given
        LaunchOptions options = LaunchOptions.parse(new String[0]);

        // when
        try (PrintQueueApplication app = PrintQueueBootstrap.start(options)) {
            app.commands().handle(ALICE, "add");

            // then
            assertThat(app.manager().currentOrder()).containsExactly(ALICE);
            assertThat(app.commands().handle(ALICE, "cancel").text())
                .isEqualTo("You are at the front of the queue; say done when you are finished");
            assertThat(app.commands().handle(BOB, "print please").text())
                .isEqualTo("unrecognized command. Your options are: add, cancel, done, and show");
        }
        assertThat(dir.toFile().list()).isEmpty();
    }

    @Test
    @DisplayName("알림 전달이 계속 실패해도 대기열은 바뀌지 않고 이벤트는 DLQ로 간다")
    void 알림_실패_대기열_불변() {
        // given
        Path file = dir.resolve("queue.txt");
        RecordingPromotionNotifier notifier = new RecordingPromotionNotifier();
        notifier.setAlwaysFail(true);

        try (PrintQueueApplication app = PrintQueueBootstrap.start(durable(file), notifier, FAST_DISPATCH)) {
            app.commands().handle(ALICE, "add");
            app.commands().handle(BOB, "add");

            // when
            app.commands().handle(ALICE, "done");

            // then
            assertThat(waitForDeadLetters(app, 1, 5000)).isTrue();
            assertThat(app.bus().getDeadLetters().get(0).event().participant()).isEqualTo(BOB);
            assertThat(app.manager().currentOrder()).containsExactly(BOB);
        }
    }

    private static boolean waitForDeadLetters(PrintQueueApplication app, int count, long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (app.bus().getDeadLetters().size() < count) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private static LaunchOptions durable(Path file) {
        return LaunchOptions.parse(new String[]{"--queue-file", file.toString()});
    }
}
