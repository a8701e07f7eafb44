package io.opgraph.task;

import java.time.Duration;
import java.util.Objects;

/**
 * A typed entry in a task's error list.
 *
 * <p>{@link Kind#CANCELLED} is a marker recorded when a task is finished by cancellation
 * without running its work. It is not a failure: {@link #isFailure()} returns false for it.
 */
public record TaskError(
        Kind kind,
        String category,
        String message,
        Throwable cause
) {
    public enum Kind {
        CONDITION_FAILED,
        CANCELLED,
        EXECUTION_FAILED,
        TIMED_OUT
    }

    private static final TaskError CANCELLED = new TaskError(Kind.CANCELLED, null, "cancelled", null);

    public TaskError {
        Objects.requireNonNull(kind, "kind");
        message = message == null || message.isBlank() ? kind.name().toLowerCase() : message;
    }

    public static TaskError cancelled() {
        return CANCELLED;
    }

    public static TaskError conditionFailed(String category, Throwable cause) {
        String detail = cause == null || cause.getMessage() == null ? "condition failed" : cause.getMessage();
        return new TaskError(Kind.CONDITION_FAILED, category, "condition " + category + " failed: " + detail, cause);
    }

    public static TaskError executionFailed(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        String detail = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new TaskError(Kind.EXECUTION_FAILED, null, detail, cause);
    }

    public static TaskError executionFailed(String message) {
        return new TaskError(Kind.EXECUTION_FAILED, null, message, null);
    }

    public static TaskError timedOut(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return new TaskError(Kind.TIMED_OUT, null, "timed out after " + timeout, null);
    }

    public boolean isFailure() {
        return kind != Kind.CANCELLED;
    }
}
