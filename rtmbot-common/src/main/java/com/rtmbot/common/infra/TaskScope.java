package com.rtmbot.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of every task a bot process runs.
 * <p>
 * The first task to fail is logged with its full stack trace, every other
 * task in the scope is cancelled, and {@link #join()} rethrows that failure.
 * Tasks that end because they were cancelled are not reported.
 */
@Slf4j
public class TaskScope implements AutoCloseable {

    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    private final String name;
    private final ExecutorService executor;
    private final List<Future<?>> futures = new ArrayList<>();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final AtomicInteger counter = new AtomicInteger();

    public TaskScope(String name) {
        this.name = name;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start a task inside this scope.
     *
     * @param label name used in failure logs
     * @param task  work to run
     */
    public synchronized Future<?> fork(String label, Task task) {
        if (executor.isShutdown()) {
            throw new IllegalStateException("Task scope " + name + " is closed");
        }
        Callable<Void> wrapped = () -> {
            try {
                task.run();
            } catch (Throwable t) {
                onFailure(label, t);
                throw t;
            }
            return null;
        };
        Future<?> future = executor.submit(wrapped);
        futures.add(future);
        return future;
    }

    /**
     * Wait for every forked task to finish.
     *
     * @throws ExecutionException   wrapping the first task failure
     * @throws InterruptedException if the caller is interrupted while waiting
     */
    public void join() throws ExecutionException, InterruptedException {
        for (Future<?> future : snapshot()) {
            if (failure.get() != null) {
                break;
            }
            try {
                future.get();
            } catch (CancellationException e) {
                log.debug("[{}] task cancelled before completion", name);
            } catch (ExecutionException e) {
                failure.compareAndSet(null, e.getCause());
            }
        }
        Throwable first = failure.get();
        if (first != null) {
            throw new ExecutionException("Task scope " + name + " failed", first);
        }
    }

    /**
     * The failure that brought this scope down, if any.
     */
    public Throwable getFailure() {
        return failure.get();
    }

    /**
     * Cancel every task in this scope.
     */
    public void cancelAll() {
        for (Future<?> future : snapshot()) {
            future.cancel(true);
        }
        executor.shutdownNow();
    }

    @Override
    public void close() {
        cancelAll();
    }

    private void onFailure(String label, Throwable t) {
        Failures.Category category = Failures.classify(t);
        if (category == Failures.Category.ABORT && failure.get() != null) {
            log.debug("[{}] task {} cancelled", name, label);
            return;
        }
        if (failure.compareAndSet(null, t)) {
            log.error("[{}] task {} failed ({}): {}; cancelling all tasks",
                    name, label, category, Failures.messageChain(t), t);
            cancelAll();
        } else {
            log.warn("[{}] task {} failed after scope shutdown: {}", name, label, Failures.messageChain(t));
        }
    }

    private synchronized List<Future<?>> snapshot() {
        return new ArrayList<>(futures);
    }
}
