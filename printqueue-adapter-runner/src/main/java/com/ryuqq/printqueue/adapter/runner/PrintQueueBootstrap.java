package com.ryuqq.printqueue.adapter.runner;

import com.ryuqq.printqueue.adapter.file.FileSnapshotStore;
import com.ryuqq.printqueue.adapter.inmemory.bus.InMemoryNotificationBus;
import com.ryuqq.printqueue.adapter.inmemory.store.InMemorySnapshotStore;
import com.ryuqq.printqueue.application.command.CommandDispatcher;
import com.ryuqq.printqueue.core.spi.PromotionNotifier;
import com.ryuqq.printqueue.core.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 대기열 서비스 조립.
 *
 * <p><strong>시작 순서:</strong></p>
 * <ol>
 *   <li>스냅샷 저장소 생성 (파일 경로가 없으면 in-memory, WARN 로그)</li>
 *   <li>{@code --clear-queue}이면 스냅샷 초기화</li>
 *   <li>스냅샷 로드 (없으면 빈 대기열, 손상되었으면 시작 거부)</li>
 *   <li>알림 버스, 관리자, 알림 디스패처 생성 후 디스패처 시작</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (PrintQueueApplication app = PrintQueueBootstrap.start(LaunchOptions.parse(args), slackNotifier)) {
 *     Reply reply = app.commands().handle(ParticipantId.of(userId), text);
 *     ...
 * }
 * </pre>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public final class PrintQueueBootstrap {

    private static final Logger log = LoggerFactory.getLogger(PrintQueueBootstrap.class);

    private PrintQueueBootstrap() {
    }

    /**
     * 채팅 어댑터 없이 시작 (알림은 로그로만 남김).
     *
     * @param options 시작 옵션
     * @return 실행 중인 서비스
     */
    public static PrintQueueApplication start(LaunchOptions options) {
        return start(options, new LoggingPromotionNotifier());
    }

    public static PrintQueueApplication start(LaunchOptions options, PromotionNotifier notifier) {
        return start(options, notifier, new DispatcherConfig());
    }

    /**
     * 서비스 조립 및 시작.
     *
     * @param options 시작 옵션
     * @param notifier 채팅 어댑터의 알림 전달자
     * @param dispatcherConfig 알림 디스패처 설정
     * @return 실행 중인 서비스
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws com.ryuqq.printqueue.core.exception.MalformedSnapshotException 스냅샷이 손상된 경우
     * @throws com.ryuqq.printqueue.core.exception.SnapshotPersistenceException 스냅샷을 읽거나 초기화할 수 없는 경우
     */
    public static PrintQueueApplication start(LaunchOptions options, PromotionNotifier notifier,
                                              DispatcherConfig dispatcherConfig) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (dispatcherConfig == null) {
            throw new IllegalArgumentException("dispatcherConfig cannot be null");
        }

        SnapshotStore store = createStore(options);

        InMemoryNotificationBus bus = new InMemoryNotificationBus();
        QueueManagerConfig managerConfig = new QueueManagerConfig().withPersistTimeoutMs(options.persistTimeoutMs());
        LockingQueueManager manager = LockingQueueManager.open(store, bus, managerConfig);

        NotificationDispatcher dispatcher = new NotificationDispatcher(bus, notifier, dispatcherConfig);
        dispatcher.start();

        return new PrintQueueApplication(manager, dispatcher, bus, new CommandDispatcher(manager));
    }

    private static SnapshotStore createStore(LaunchOptions options) {
        if (!options.isDurable()) {
            log.warn("No queue file configured; running in memory. The queue will be lost on restart");
            if (options.clearQueue()) {
                log.info("--clear-queue has no effect without a queue file");
            }
            return new InMemorySnapshotStore();
        }

        FileSnapshotStore store = new FileSnapshotStore(options.queueFileOrNull());
        if (options.clearQueue()) {
            store.clear();
        }
        log.info("Using queue file {}", store.getFile());
        return store;
    }
}
