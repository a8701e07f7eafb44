package io.opgraph.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs submitted actions one at a time, in submission order, on borrowed threads of a
 * backing executor. No thread is held while the queue is empty.
 */
final class SerialExecutor implements Executor {
    private static final Logger log = LoggerFactory.getLogger(SerialExecutor.class);

    private final String name;
    private final Executor backing;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    SerialExecutor(String name, Executor backing) {
        this.name = name;
        this.backing = Objects.requireNonNull(backing, "backing");
    }

    @Override
    public void execute(Runnable action) {
        queue.offer(Objects.requireNonNull(action, "action"));
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (!queue.isEmpty() && draining.compareAndSet(false, true)) {
            try {
                backing.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                throw e;
            }
        }
    }

    private void drain() {
        try {
            Runnable action;
            while ((action = queue.poll()) != null) {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.error("Action failed on serial executor {}", name, e);
                }
            }
        } finally {
            draining.set(false);
            // an offer may have landed between the last poll and the reset
            scheduleDrain();
        }
    }
}
