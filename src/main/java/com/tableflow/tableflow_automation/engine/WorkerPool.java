package com.tableflow.tableflow_automation.engine;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool with a bounded queue. A full queue rejects the task instead of
 * blocking the caller. Delayed tasks wait on a single timer thread, then enter the queue.
 */
@Slf4j
public class WorkerPool {

    private final String name;
    private final ThreadPoolExecutor executor;
    private final ScheduledExecutorService timer;

    public WorkerPool(String name, int threads, int queueCapacity) {
        this.name = name;
        int workers = Math.max(1, threads);
        this.executor = new ThreadPoolExecutor(
                workers,
                workers,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(1, queueCapacity)),
                threadFactory(name),
                new ThreadPoolExecutor.AbortPolicy());
        this.timer = Executors.newSingleThreadScheduledExecutor(threadFactory(name + "-timer"));
    }

    /** Returns false when the queue is full or the pool is shut down. */
    public boolean submit(Runnable task) {
        try {
            executor.execute(task);
            return true;
        } catch (RejectedExecutionException ex) {
            log.error("Worker pool '{}' rejected a task: queue full or shut down ({} queued)",
                    name, executor.getQueue().size());
            return false;
        }
    }

    public boolean submitAfter(Duration delay, Runnable task) {
        return submitAfter(delay, task, () -> { });
    }

    /** onRejected runs on the timer thread when the delayed task cannot enter the queue. */
    public boolean submitAfter(Duration delay, Runnable task, Runnable onRejected) {
        if (delay.isZero() || delay.isNegative()) {
            return submit(task);
        }
        try {
            timer.schedule(() -> {
                if (!submit(task)) {
                    onRejected.run();
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException ex) {
            log.error("Worker pool '{}' is shut down, delayed task dropped", name);
            return false;
        }
    }

    public int queuedTasks() {
        return executor.getQueue().size();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /** Stops accepting work and waits up to the grace period for running tasks. */
    public void shutdown(Duration grace) {
        timer.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool '{}' did not drain within {} ms, interrupting workers", name, grace.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
