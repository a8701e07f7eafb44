package io.opgraph.scheduler;

import io.opgraph.config.EngineConfig;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Threads shared by one or more schedulers: a growable worker executor for task work,
 * condition evaluation and admission, plus a timer for delayed completions.
 *
 * <p>The worker executor does not bound the number of threads; schedulers bound the
 * number of executing tasks themselves, so tasks that block their thread cannot starve
 * admission.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Object COMMON_LOCK = new Object();
    private static volatile WorkerPool common;

    private final String name;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;

    public WorkerPool(String name, EngineConfig config) {
        this(name, config, false);
    }

    private WorkerPool(String name, EngineConfig config, boolean daemon) {
        this.name = name == null || name.isBlank() ? "opgraph" : name.trim();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                config.workerCoreThreads(),
                Integer.MAX_VALUE,
                config.workerKeepAliveMs(),
                TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(),
                threadFactory(this.name + "-worker-", daemon)
        );
        this.workers = pool;
        ScheduledThreadPoolExecutor scheduled = new ScheduledThreadPoolExecutor(
                config.timerThreads(),
                threadFactory(this.name + "-timer-", daemon)
        );
        scheduled.setRemoveOnCancelPolicy(true);
        this.timer = scheduled;
    }

    /**
     * Process-wide pool with daemon threads, created on first use and never closed.
     */
    public static WorkerPool common() {
        WorkerPool current = common;
        if (current != null) {
            return current;
        }
        synchronized (COMMON_LOCK) {
            if (common == null) {
                common = new WorkerPool("opgraph-common", EngineConfig.defaults(), true);
            }
            return common;
        }
    }

    public String name() {
        return name;
    }

    public ExecutorService workers() {
        return workers;
    }

    public ScheduledExecutorService timer() {
        return timer;
    }

    @Override
    public void close() {
        if (this == common) {
            throw new IllegalStateException("The common worker pool cannot be closed");
        }
        timer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threadFactory(String prefix, boolean daemon) {
        AtomicLong counter = new AtomicLong(1L);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
