package io.opgraph.task;

/**
 * Thrown when a task's finish signal is invoked a second time.
 */
public final class DoubleFinishException extends IllegalStateException {
    public DoubleFinishException(Task task) {
        super("Task finished twice: " + task);
    }
}
