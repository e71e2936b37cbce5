package com.ryuqq.printqueue.adapter.runner;

import com.ryuqq.printqueue.application.manager.QueueHealth;
import com.ryuqq.printqueue.application.manager.QueueManager;
import com.ryuqq.printqueue.core.event.Promoted;
import com.ryuqq.printqueue.core.exception.QueueUnhealthyException;
import com.ryuqq.printqueue.core.exception.SnapshotPersistenceException;
import com.ryuqq.printqueue.core.model.ParticipantId;
import com.ryuqq.printqueue.core.model.Position;
import com.ryuqq.printqueue.core.model.Promotion;
import com.ryuqq.printqueue.core.outcome.QueueOutcome;
import com.ryuqq.printqueue.core.spi.NotificationBus;
import com.ryuqq.printqueue.core.spi.SnapshotStore;
import com.ryuqq.printqueue.core.waitlist.Waitlist;
import com.ryuqq.printqueue.core.waitlist.WaitlistSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Queue Manager 구현체.
 *
 * <p>공정한 {@link ReentrantReadWriteLock}으로 대기열을 보호하고, 모든 변경을
 * copy-on-write 방식으로 영속화한 뒤에만 반영합니다.</p>
 *
 * <p><strong>변경 처리 흐름:</strong></p>
 * <pre>
 * addSelf / finishTurn / cancelSelf 호출
 *   ↓
 * writeLock 획득 (FIFO 순서)
 *   ↓
 * 1. 상태 확인 (UNHEALTHY → QueueUnhealthyException)
 * 2. waitlist.copy()에 규칙 적용
 *    - Rejected → 즉시 반환 (저장/알림 없음)
 * 3. 복사본 스냅샷을 영속화 스레드에서 저장, persistTimeoutMs 동안 대기
 *    - 실패/타임아웃 → 복사본 폐기 (롤백), SnapshotPersistenceException
 * 4. 복사본을 현재 상태로 교체 (커밋)
 * 5. 맨 앞이 바뀌었으면 Promoted 이벤트 발행 (실패해도 커밋 유지)
 *   ↓
 * writeLock 해제
 * </pre>
 *
 * <p><strong>상태 전환:</strong></p>
 * <ul>
 *   <li>쓰기 타임아웃: 디스크 상태를 알 수 없으므로 즉시 UNHEALTHY</li>
 *   <li>연속 실패가 maxConsecutivePersistFailures에 도달: UNHEALTHY</li>
 *   <li>쓰기 성공: 연속 실패 카운트 초기화</li>
 *   <li>UNHEALTHY에서는 조회만 허용되며, 재시작으로만 복구</li>
 * </ul>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public final class LockingQueueManager implements QueueManager {

    private static final Logger log = LoggerFactory.getLogger(LockingQueueManager.class);

    private final SnapshotStore store;
    private final NotificationBus bus;
    private final QueueManagerConfig config;
    private final ReentrantReadWriteLock lock;
    private final ExecutorService persistenceExecutor;

    /**
     * 현재 커밋된 대기열. writeLock 보유 중에만 교체됩니다.
     */
    private Waitlist waitlist;

    /**
     * writeLock 보유 중에만 변경됩니다.
     */
    private int consecutiveFailures;

    private volatile QueueHealth health;
    private volatile boolean closed;

    /**
     * 생성자.
     *
     * @param store 스냅샷 저장소
     * @param bus 알림 버스
     * @param config 설정
     * @param initialState 시작 시 대기열 상태 (저장소에서 로드한 스냅샷)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public LockingQueueManager(SnapshotStore store, NotificationBus bus, QueueManagerConfig config,
                               WaitlistSnapshot initialState) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (initialState == null) {
            throw new IllegalArgumentException("initialState cannot be null");
        }

        this.store = store;
        this.bus = bus;
        this.config = config;
        this.lock = new ReentrantReadWriteLock(true);
        this.persistenceExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "printqueue-persistence");
            thread.setDaemon(true);
            return thread;
        });
        this.waitlist = Waitlist.restore(initialState);
        this.health = QueueHealth.HEALTHY;
    }

    /**
     * 저장소에서 스냅샷을 로드하여 관리자 생성.
     *
     * <p>스냅샷이 없으면 빈 대기열로 시작합니다.</p>
     *
     * @param store 스냅샷 저장소
     * @param bus 알림 버스
     * @param config 설정
     * @return 관리자
     * @throws com.ryuqq.printqueue.core.exception.MalformedSnapshotException 스냅샷이 손상된 경우 (시작 거부)
     * @throws SnapshotPersistenceException 스냅샷을 읽을 수 없는 경우
     */
    public static LockingQueueManager open(SnapshotStore store, NotificationBus bus, QueueManagerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        WaitlistSnapshot initialState = store.load().orElse(WaitlistSnapshot.empty());
        LockingQueueManager manager = new LockingQueueManager(store, bus, config, initialState);
        log.info("Queue manager started with {} entries (durable: {})",
            initialState.entries().size(), store.isDurable());
        return manager;
    }

    @Override
    public QueueOutcome<Position> addSelf(ParticipantId participant) {
        return mutate("add", participant, candidate -> candidate.add(participant));
    }

    @Override
    public QueueOutcome<Promotion> finishTurn(ParticipantId participant) {
        return mutate("done", participant, candidate -> candidate.removeFront(participant));
    }

    @Override
    public QueueOutcome<Position> cancelSelf(ParticipantId participant) {
        return mutate("cancel", participant, candidate -> candidate.removeSelf(participant));
    }

    @Override
    public List<ParticipantId> currentOrder() {
        lock.readLock().lock();
        try {
            return waitlist.snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public QueueHealth health() {
        return health;
    }

    /**
     * 영속화 스레드 종료.
     *
     * <p>진행 중인 쓰기는 shutdownTimeoutMs 동안 완료를 기다립니다. 이후 변경 요청은
     * IllegalStateException으로 거부되고 조회는 계속 동작합니다.</p>
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            lock.writeLock().unlock();
        }

        persistenceExecutor.shutdown();
        try {
            if (!persistenceExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                persistenceExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            persistenceExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Queue manager closed with {} entries", currentOrder().size());
    }

    /**
     * 변경 연산 공통 처리 (규칙 평가 → 영속화 → 커밋 → 알림).
     *
     * @param operation 로그용 연산 이름
     * @param participant 요청자
     * @param rule 복사본에 적용할 규칙
     * @return 규칙 결과
     */
    private <T> QueueOutcome<T> mutate(String operation, ParticipantId participant,
                                       Function<Waitlist, QueueOutcome<T>> rule) {
        if (participant == null) {
            throw new IllegalArgumentException("participant cannot be null");
        }

        lock.writeLock().lock();
        try {
            ensureWritable();

            Waitlist candidate = waitlist.copy();
            QueueOutcome<T> outcome = rule.apply(candidate);

            if (outcome.isRejected()) {
                log.debug("{} by {} rejected: {}", operation, participant.getValue(), outcome.rejectionOrNull());
                return outcome;
            }

            persist(candidate.toSnapshot());
            waitlist = candidate;
            log.debug("{} by {} committed ({} entries)", operation, participant.getValue(), candidate.size());

            Object value = outcome.valueOrThrow();
            if (value instanceof Promotion promotion && promotion.hasNewFront()) {
                publishPromotion(promotion.getNewFrontOrNull());
            }
            return outcome;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void ensureWritable() {
        if (closed) {
            throw new IllegalStateException("queue manager is closed");
        }
        if (health == QueueHealth.UNHEALTHY) {
            throw new QueueUnhealthyException("queue manager is unhealthy; restart required");
        }
    }

    /**
     * 스냅샷을 영속화 스레드에서 저장하고 완료를 대기.
     *
     * @param snapshot 저장할 스냅샷
     * @throws SnapshotPersistenceException 저장 실패, 타임아웃 또는 인터럽트
     */
    private void persist(WaitlistSnapshot snapshot) {
        Future<?> write;
        try {
            write = persistenceExecutor.submit(() -> store.save(snapshot));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("queue manager is closed", e);
        }

        try {
            write.get(config.persistTimeoutMs(), TimeUnit.MILLISECONDS);
            consecutiveFailures = 0;
        } catch (TimeoutException e) {
            write.cancel(true);
            markUnhealthy("snapshot write timed out after " + config.persistTimeoutMs() + "ms");
            throw new SnapshotPersistenceException(
                "Snapshot write timed out after " + config.persistTimeoutMs() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            write.cancel(true);
            markUnhealthy("interrupted while waiting for snapshot write");
            throw new SnapshotPersistenceException("Interrupted while waiting for snapshot write", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            recordFailure(cause);
            if (cause instanceof SnapshotPersistenceException persistenceFailure) {
                throw persistenceFailure;
            }
            throw new SnapshotPersistenceException("Snapshot write failed", cause);
        }
    }

    private void recordFailure(Throwable cause) {
        consecutiveFailures++;
        log.error("Snapshot write failed ({} consecutive): {}", consecutiveFailures, cause.getMessage(), cause);
        if (consecutiveFailures >= config.maxConsecutivePersistFailures()) {
            markUnhealthy(consecutiveFailures + " consecutive snapshot write failures");
        }
    }

    private void markUnhealthy(String reason) {
        health = QueueHealth.UNHEALTHY;
        log.error("Queue manager is now UNHEALTHY: {}. Mutations are refused until restart", reason);
    }

    private void publishPromotion(ParticipantId newFront) {
        try {
            bus.publish(Promoted.now(newFront));
        } catch (RuntimeException e) {
            log.error("Failed to publish promotion for {}; queue state is unaffected", newFront.getValue(), e);
        }
    }
}
