package com.ryuqq.printqueue.adapter.runner;

import com.ryuqq.printqueue.adapter.inmemory.bus.InMemoryNotificationBus;
import com.ryuqq.printqueue.application.command.CommandDispatcher;
import com.ryuqq.printqueue.application.manager.QueueManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 조립된 대기열 서비스 핸들.
 *
 * <p>채팅 어댑터는 {@link #commands()}로 메시지를 처리하고, 종료 시 {@link #close()}를 호출합니다.
 * 종료 순서는 알림 전달 중지, 그 다음 관리자 종료입니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public final class PrintQueueApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PrintQueueApplication.class);

    private final QueueManager manager;
    private final NotificationDispatcher dispatcher;
    private final InMemoryNotificationBus bus;
    private final CommandDispatcher commands;

    PrintQueueApplication(QueueManager manager, NotificationDispatcher dispatcher,
                          InMemoryNotificationBus bus, CommandDispatcher commands) {
        this.manager = manager;
        this.dispatcher = dispatcher;
        this.bus = bus;
        this.commands = commands;
    }

    public QueueManager manager() {
        return manager;
    }

    public NotificationDispatcher dispatcher() {
        return dispatcher;
    }

    public InMemoryNotificationBus bus() {
        return bus;
    }

    public CommandDispatcher commands() {
        return commands;
    }

    @Override
    public void close() {
        log.info("Shutting down print queue ({} pending notifications)", bus.pendingCount());
        dispatcher.shutdown();
        manager.close();
    }
}
