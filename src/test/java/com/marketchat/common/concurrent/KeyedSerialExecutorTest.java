package com.marketchat.common.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyedSerialExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);
    private final KeyedSerialExecutor<Long> executor = new KeyedSerialExecutor<>(pool);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldRunTasksOfSameKeySequentially() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch allowFirstFinish = new CountDownLatch(1);
        AtomicBoolean secondStarted = new AtomicBoolean(false);

        CompletableFuture<Void> f1 = executor.run(1L, () -> {
            firstStarted.countDown();
            await(allowFirstFinish);
        });
        CompletableFuture<Void> f2 = executor.run(1L, () -> secondStarted.set(true));

        assertTrue(firstStarted.await(2, TimeUnit.SECONDS));
        TimeUnit.MILLISECONDS.sleep(80);
        assertFalse(secondStarted.get());

        allowFirstFinish.countDown();
        CompletableFuture.allOf(f1, f2).get(2, TimeUnit.SECONDS);
        assertTrue(secondStarted.get());
    }

    @Test
    void shouldNotBlockOtherKeys() throws Exception {
        CountDownLatch allowFirstFinish = new CountDownLatch(1);
        CompletableFuture<Void> blocked = executor.run(1L, () -> await(allowFirstFinish));

        String other = executor.submit(2L, () -> "done").get(2, TimeUnit.SECONDS);
        assertThat(other).isEqualTo("done");
        assertFalse(blocked.isDone());

        allowFirstFinish.countDown();
        blocked.get(2, TimeUnit.SECONDS);
    }

    @Test
    void shouldContinueAfterFailure() throws Exception {
        CompletableFuture<Void> f1 = executor.run(7L, () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<Integer> f2 = executor.submit(7L, () -> 42);

        assertThrows(Exception.class, () -> f1.get(2, TimeUnit.SECONDS));
        assertThat(f2.get(2, TimeUnit.SECONDS)).isEqualTo(42);
    }

    @Test
    void shouldPreserveSubmissionOrder() throws Exception {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        CompletableFuture<?>[] fs = new CompletableFuture<?>[50];
        for (int i = 0; i < fs.length; i++) {
            int n = i;
            fs[i] = executor.run(3L, () -> seen.add(n));
        }
        CompletableFuture.allOf(fs).get(5, TimeUnit.SECONDS);

        assertThat(seen).hasSize(50);
        for (int i = 0; i < 50; i++) {
            assertThat(seen.get(i)).isEqualTo(i);
        }
    }

    @Test
    void shouldReleaseKeyWhenIdle() throws Exception {
        executor.run(9L, () -> {
        }).get(2, TimeUnit.SECONDS);

        long deadline = System.currentTimeMillis() + 1000;
        while (executor.activeKeys() > 0 && System.currentTimeMillis() < deadline) {
            TimeUnit.MILLISECONDS.sleep(5);
        }
        assertThat(executor.activeKeys()).isZero();
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(2, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }
}
