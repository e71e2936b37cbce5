package com.ryuqq.printqueue.adapter.runner;

import com.ryuqq.printqueue.adapter.inmemory.bus.InMemoryNotificationBus;
import com.ryuqq.printqueue.adapter.inmemory.store.InMemorySnapshotStore;
import com.ryuqq.printqueue.application.manager.QueueHealth;
import com.ryuqq.printqueue.core.exception.QueueUnhealthyException;
import com.ryuqq.printqueue.core.exception.SnapshotPersistenceException;
import com.ryuqq.printqueue.core.model.ParticipantId;
import com.ryuqq.printqueue.core.waitlist.WaitlistSnapshot;
import com.ryuqq.printqueue.testkit.fake.FaultInjectingSnapshotStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 스냅샷 쓰기 지연 테스트.
 *
 * <p>쓰기가 persistTimeoutMs 안에 끝나지 않으면 디스크 상태를 알 수 없으므로
 * 변경은 롤백되고 관리자는 UNHEALTHY가 되어야 합니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
@DisplayName("스냅샷 쓰기 타임아웃 테스트")
class PersistTimeoutTest {

    private static final ParticipantId ALICE = ParticipantId.of("UA8RXUPSP");
    private static final ParticipantId BOB = ParticipantId.of("UNB2LMZRP");

    private FaultInjectingSnapshotStore store;
    private InMemoryNotificationBus bus;
    private LockingQueueManager manager;

    @BeforeEach
    void setUp() {
        store = new FaultInjectingSnapshotStore(new InMemorySnapshotStore());
        bus = new InMemoryNotificationBus();
        manager = new LockingQueueManager(store, bus,
            new QueueManagerConfig().withPersistTimeoutMs(200).withShutdownTimeoutMs(1000), WaitlistSnapshot.empty());
    }

    @AfterEach
    void tearDown() {
        store.releaseSaves();
        manager.close();
    }

    @Test
    @DisplayName("쓰기가 멈추면 타임아웃 후 롤백되고 UNHEALTHY가 된다")
    void 쓰기_지연_타임아웃_UNHEALTHY() {
        // given
        manager.addSelf(ALICE);
        manager.addSelf(BOB);
        store.blockSaves();

        // when & then
        assertThatThrownBy(() -> manager.finishTurn(ALICE))
            .isInstanceOf(SnapshotPersistenceException.class)
            .hasCauseInstanceOf(TimeoutException.class);

        assertThat(manager.health()).isEqualTo(QueueHealth.UNHEALTHY);
        assertThat(manager.currentOrder()).containsExactly(ALICE, BOB);
        assertThat(bus.pendingCount()).isZero();
    }

    @Test
    @DisplayName("UNHEALTHY 상태에서는 변경이 거부되고 조회는 동작한다")
    void UNHEALTHY_변경_거부_조회_허용() {
        // given
        manager.addSelf(ALICE);
        store.blockSaves();
        assertThatThrownBy(() -> manager.addSelf(BOB)).isInstanceOf(SnapshotPersistenceException.class);
        store.releaseSaves();
        int attemptsBefore = store.getSaveAttempts();

        // when & then
        assertThatThrownBy(() -> manager.addSelf(BOB)).isInstanceOf(QueueUnhealthyException.class);
        assertThat(manager.currentOrder()).containsExactly(ALICE);
        assertThat(store.getSaveAttempts()).isEqualTo(attemptsBefore);
    }

    @Test
    @DisplayName("주입된 쓰기 실패는 롤백되고 한 번으로는 UNHEALTHY가 되지 않는다")
    void 단일_쓰기_실패_롤백() {
        // given
        manager.addSelf(ALICE);
        store.failNextSaves(1);

        // when & then
        assertThatThrownBy(() -> manager.addSelf(BOB)).isInstanceOf(SnapshotPersistenceException.class);
        assertThat(manager.health()).isEqualTo(QueueHealth.HEALTHY);
        assertThat(manager.currentOrder()).containsExactly(ALICE);
        assertThat(store.getDelegate().load().orElseThrow().entries()).containsExactly(ALICE);

        assertThat(manager.addSelf(BOB).isOk()).isTrue();
        assertThat(store.getDelegate().load().orElseThrow().entries()).containsExactly(ALICE, BOB);
    }
}
