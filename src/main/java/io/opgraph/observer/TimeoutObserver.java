package io.opgraph.observer;

import io.opgraph.task.Task;
import io.opgraph.task.TaskError;
import io.opgraph.task.TaskHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancels a task that is still running {@code timeout} after it started, recording a
 * {@link TaskError.Kind#TIMED_OUT} error. The task decides how quickly it stops.
 *
 * <p>One instance per task. Without an explicit timer the owning scheduler's timer is used.
 */
public final class TimeoutObserver implements Observer {
    private static final Logger log = LoggerFactory.getLogger(TimeoutObserver.class);

    private final Duration timeout;
    private final ScheduledExecutorService timer;
    private final AtomicReference<ScheduledFuture<?>> pending = new AtomicReference<>();

    public TimeoutObserver(Duration timeout) {
        this(timeout, null);
    }

    public TimeoutObserver(Duration timeout, ScheduledExecutorService timer) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
        this.timer = timer;
    }

    @Override
    public void onStart(Task task) {
        ScheduledExecutorService scheduler = timer != null
                ? timer
                : task.host().map(TaskHost::timer)
                        .orElseThrow(() -> new IllegalStateException("Task " + task + " has no scheduler timer"));
        ScheduledFuture<?> future = scheduler.schedule(() -> expire(task), timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (!pending.compareAndSet(null, future)) {
            future.cancel(false);
            throw new IllegalStateException("TimeoutObserver is already attached to a started task");
        }
    }

    @Override
    public void onFinish(Task task, List<TaskError> errors) {
        ScheduledFuture<?> future = pending.get();
        if (future != null) {
            future.cancel(false);
        }
    }

    private void expire(Task task) {
        if (task.isFinished()) {
            return;
        }
        if (task.cancelWithError(TaskError.timedOut(timeout))) {
            log.warn("Task {} timed out after {}", task, timeout);
        }
    }
}
