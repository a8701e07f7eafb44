package io.opgraph.task;

import java.util.Objects;

/**
 * A task whose work is a lambda.
 *
 * <p>{@link #async(String, Body)} hands the body a {@link FinishSignal} to use once, from
 * any thread. {@link #of(String, Work)} runs synchronous work and finishes when it returns;
 * an exception from the work becomes an execution error.
 */
public final class BlockTask extends Task {
    @FunctionalInterface
    public interface Body {
        void run(BlockTask task, FinishSignal signal) throws Exception;
    }

    @FunctionalInterface
    public interface Work {
        void run(BlockTask task) throws Exception;
    }

    private final Body body;

    private BlockTask(String name, Body body) {
        super(name);
        this.body = Objects.requireNonNull(body, "body");
    }

    public static BlockTask async(String name, Body body) {
        return new BlockTask(name, body);
    }

    public static BlockTask of(String name, Work work) {
        Objects.requireNonNull(work, "work");
        return new BlockTask(name, (task, signal) -> {
            work.run(task);
            signal.finish();
        });
    }

    public static BlockTask noop(String name) {
        return of(name, task -> {
        });
    }

    @Override
    protected void execute() throws Exception {
        body.run(this, finishSignal());
    }
}
