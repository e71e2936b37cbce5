package com.ryuqq.printqueue.adapter.inmemory.bus;

import com.ryuqq.printqueue.core.event.Promoted;
import com.ryuqq.printqueue.core.spi.NotificationBus;
import com.ryuqq.printqueue.testkit.contract.AbstractNotificationBusContractTest;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryNotificationBus Contract 테스트.
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
class InMemoryNotificationBusContractTest extends AbstractNotificationBusContractTest {

    @Override
    protected NotificationBus createBus() {
        return new InMemoryNotificationBus();
    }

    @Test
    void publishToDeadLetter_RecordsReason() {
        // Given
        InMemoryNotificationBus inMemory = (InMemoryNotificationBus) bus;
        Promoted event = Promoted.now(BOB);

        // When
        inMemory.publishToDeadLetter(event, "chat API unavailable");

        // Then
        assertThat(inMemory.getDeadLetters()).hasSize(1);
        assertThat(inMemory.getDeadLetters().get(0).event()).isEqualTo(event);
        assertThat(inMemory.getDeadLetters().get(0).reason()).isEqualTo("chat API unavailable");
    }

    @Test
    void publish_Concurrent_NoEventLost() throws InterruptedException {
        // Given
        InMemoryNotificationBus inMemory = (InMemoryNotificationBus) bus;
        int threadCount = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);

        // When
        for (int t = 0; t < threadCount; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < perThread; i++) {
                        inMemory.publish(Promoted.now(ALICE));
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        // Then
        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(inMemory.pendingCount()).isEqualTo(threadCount * perThread);
        assertThat(inMemory.dequeue(threadCount * perThread)).hasSize(threadCount * perThread);
    }

    @Test
    void clear_DropsPendingAndDeadLetters() {
        // Given
        InMemoryNotificationBus inMemory = (InMemoryNotificationBus) bus;
        inMemory.publish(Promoted.now(ALICE));
        inMemory.publishToDeadLetter(Promoted.now(BOB), "gone");

        // When
        inMemory.clear();

        // Then
        assertThat(inMemory.pendingCount()).isZero();
        assertThat(inMemory.getDeadLetters()).isEmpty();
    }
}
