package com.marketchat.common.concurrent;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 按 key 串行执行任务（Future 链）：同一个 key 的任务按提交顺序逐个执行，不同 key 之间互不等待。
 *
 * <p>用途：</p>
 * <ul>
 *   <li>会话维度：发送/已读/送达 的状态迁移和未读计数</li>
 *   <li>用户维度：在线状态写入</li>
 * </ul>
 *
 * <p>注意：链会“吞掉”上一任务的异常以保证后续任务继续执行；但返回给调用方的 future 保留异常。
 * 某个 key 的链跑完后会从 map 中移除，空闲 key 不占内存。</p>
 */
public final class KeyedSerialExecutor<K> {

    private final ConcurrentHashMap<K, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final Executor executor;

    public KeyedSerialExecutor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public <T> CompletableFuture<T> submit(K key, Supplier<T> task) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(task, "task");

        AtomicReference<CompletableFuture<T>> out = new AtomicReference<>();
        CompletableFuture<Void> tail = tails.compute(key, (k, prev) -> {
            CompletableFuture<Void> base = prev == null ? CompletableFuture.completedFuture(null) : prev;
            CompletableFuture<T> run = base.thenCompose(ignored -> runOnExecutor(task));
            out.set(run);
            return run.handle((v, e) -> null);
        });
        // 回调放在 compute 之外注册：tail 可能已完成，回调会同步执行，不能在 compute 内部再改 map
        tail.whenComplete((v, e) -> tails.remove(key, tail));
        return out.get();
    }

    public CompletableFuture<Void> run(K key, Runnable task) {
        Objects.requireNonNull(task, "task");
        return submit(key, () -> {
            task.run();
            return null;
        });
    }

    /** 当前仍有未完成任务的 key 数量（监控/测试用）。 */
    public int activeKeys() {
        return tails.size();
    }

    private <T> CompletableFuture<T> runOnExecutor(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
