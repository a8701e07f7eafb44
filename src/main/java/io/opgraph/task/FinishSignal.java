package io.opgraph.task;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot completion handle for a task's asynchronous work.
 * Any thread may use it; a second use throws {@link DoubleFinishException}.
 */
public final class FinishSignal {
    private final Task task;
    private final AtomicBoolean used = new AtomicBoolean(false);

    FinishSignal(Task task) {
        this.task = Objects.requireNonNull(task, "task");
    }

    public void finish() {
        finish(List.of());
    }

    public void fail(Throwable cause) {
        finish(List.of(TaskError.executionFailed(cause)));
    }

    public void finish(List<TaskError> errors) {
        if (!used.compareAndSet(false, true)) {
            throw new DoubleFinishException(task);
        }
        task.finish(errors);
    }

    public boolean isUsed() {
        return used.get();
    }

    public Task task() {
        return task;
    }
}
