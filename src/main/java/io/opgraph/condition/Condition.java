package io.opgraph.condition;

import io.opgraph.task.Task;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * An asynchronous precondition guarding a {@link Task}.
 *
 * <p>A condition may contribute one extra dependency that must finish before the guarded
 * task is evaluated (for example "request permission" ahead of "use permission"), and it
 * may veto execution. {@link #evaluate} must not block: it reports its verdict once
 * through {@code completion}, from any thread, now or later.
 *
 * <p>When {@link #isMutuallyExclusive()} is true, {@link #exclusivityCategory()} (the
 * {@link #category()} unless a wrapper says otherwise) is an exclusivity key: tasks
 * sharing it run one at a time, in submission order.
 */
public interface Condition {
    String category();

    default boolean isMutuallyExclusive() {
        return false;
    }

    default String exclusivityCategory() {
        return category();
    }

    default Optional<Task> dependency(Task task) {
        return Optional.empty();
    }

    void evaluate(Task task, Consumer<ConditionResult> completion);
}
