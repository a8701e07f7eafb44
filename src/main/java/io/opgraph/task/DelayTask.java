package io.opgraph.task;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Finishes after a wall-clock interval or at a target instant.
 *
 * <p>While waiting the task stays {@link TaskState#EXECUTING} but holds no worker thread:
 * {@link #execute()} arms a one-shot timer and returns. Cancelling while the timer is
 * armed disarms it and finishes with the cancellation marker. A timer that already fired
 * wins over a later cancellation.
 */
public final class DelayTask extends Task {
    private final Duration interval;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean settled = new AtomicBoolean(false);
    private final AtomicReference<ScheduledFuture<?>> armed = new AtomicReference<>();
    private volatile boolean usedTimer;

    private DelayTask(String name, Duration interval, Instant deadline, Clock clock) {
        super(name);
        this.interval = interval;
        this.deadline = deadline;
        this.clock = clock;
    }

    public static DelayTask of(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        return new DelayTask("Delay for " + interval, interval, null, Clock.systemUTC());
    }

    public static DelayTask ofMillis(long millis) {
        return of(Duration.ofMillis(millis));
    }

    public static DelayTask until(Instant deadline) {
        return until(deadline, Clock.systemUTC());
    }

    public static DelayTask until(Instant deadline, Clock clock) {
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(clock, "clock");
        return new DelayTask("Delay until " + deadline, null, deadline, clock);
    }

    public Duration remaining() {
        if (deadline != null) {
            return Duration.between(clock.instant(), deadline);
        }
        return interval;
    }

    @Override
    protected void execute() {
        Duration remaining = remaining();
        if (remaining.isNegative() || remaining.isZero()) {
            if (settled.compareAndSet(false, true)) {
                finish();
            }
            return;
        }
        usedTimer = true;
        ScheduledFuture<?> future = timer().schedule(this::fire, remaining.toNanos(), TimeUnit.NANOSECONDS);
        armed.set(future);
        // a cancel that landed before the future was stored could not disarm it
        if (settled.get()) {
            future.cancel(false);
        }
    }

    @Override
    protected void onCancelled() {
        if (state() != TaskState.EXECUTING || !settled.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> future = armed.get();
        if (future != null) {
            future.cancel(false);
        }
        finish(List.of(TaskError.cancelled()));
    }

    private void fire() {
        if (settled.compareAndSet(false, true)) {
            finish();
        }
    }

    boolean usedTimer() {
        return usedTimer;
    }
}
