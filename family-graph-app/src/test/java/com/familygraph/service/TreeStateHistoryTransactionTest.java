package com.familygraph.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * History behaviour across real transaction boundaries. Runs without a
 * test-managed transaction and writes no rows, so every transaction here
 * commits or rolls back on its own.
 */
@SpringBootTest
@ActiveProfiles("test")
class TreeStateHistoryTransactionTest {

    @Autowired
    private TreeStateService treeStateService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        transactionTemplate = new TransactionTemplate(transactionManager);
        treeStateService.clearHistory();
    }

    @AfterEach
    void tearDown() {
        treeStateService.clearHistory();
    }

    @Nested
    @DisplayName("rollback")
    class Rollback {

        @Test
        void committedActionStaysUndoable() {
            transactionTemplate.executeWithoutResult(status -> treeStateService.recordAction("create_person"));

            assertThat(treeStateService.canUndo()).isTrue();
        }

        @Test
        void rolledBackActionLeavesNoEntry() {
            transactionTemplate.executeWithoutResult(status -> {
                treeStateService.recordAction("create_person");
                status.setRollbackOnly();
            });

            assertThat(treeStateService.canUndo()).isFalse();
        }

        @Test
        void rolledBackActionKeepsRedoHistory() {
            transactionTemplate.executeWithoutResult(status -> treeStateService.recordAction("first"));
            assertThat(treeStateService.undo()).isTrue();
            assertThat(treeStateService.canRedo()).isTrue();

            transactionTemplate.executeWithoutResult(status -> {
                treeStateService.recordAction("second");
                status.setRollbackOnly();
            });

            assertThat(treeStateService.canUndo()).isFalse();
            assertThat(treeStateService.canRedo()).isTrue();
        }
    }

    @Nested
    @DisplayName("concurrent transactions")
    class Concurrency {

        @Test
        void secondActionWaitsForFirstTransactionToComplete() throws Exception {
            CountDownLatch recorded = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<?> first = executor.submit(() -> transactionTemplate.executeWithoutResult(status -> {
                    treeStateService.recordAction("first");
                    recorded.countDown();
                    awaitQuietly(release);
                }));
                assertThat(recorded.await(5, TimeUnit.SECONDS)).isTrue();

                Future<?> second = executor.submit(() -> transactionTemplate.executeWithoutResult(
                        status -> treeStateService.recordAction("second")));
                Thread.sleep(200);
                assertThat(second.isDone()).isFalse();

                release.countDown();
                first.get(5, TimeUnit.SECONDS);
                second.get(5, TimeUnit.SECONDS);
            } finally {
                release.countDown();
                executor.shutdownNow();
            }

            int undone = 0;
            while (treeStateService.undo()) {
                undone++;
            }
            assertThat(undone).isEqualTo(2);
        }

        private void awaitQuietly(CountDownLatch latch) {
            try {
                latch.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
