package io.opgraph.condition;

import io.opgraph.task.Task;

import java.util.List;
import java.util.function.Consumer;

/**
 * Vetoes a task when any of its dependencies finished with failures, or, unless
 * {@code ignoreCancellations} is set, when any of them was cancelled.
 */
public final class NoFailedDependenciesCondition implements Condition {
    public static final String CATEGORY = "NoFailedDependencies";

    private final boolean ignoreCancellations;

    public NoFailedDependenciesCondition() {
        this(false);
    }

    public NoFailedDependenciesCondition(boolean ignoreCancellations) {
        this.ignoreCancellations = ignoreCancellations;
    }

    @Override
    public String category() {
        return CATEGORY;
    }

    @Override
    public void evaluate(Task task, Consumer<ConditionResult> completion) {
        List<Task> dependencies = task.dependencies();
        List<String> failed = dependencies.stream()
                .filter(Task::hasFailures)
                .map(Task::name)
                .toList();
        if (!failed.isEmpty()) {
            completion.accept(ConditionResult.failed(CATEGORY, "dependencies failed: " + String.join(", ", failed)));
            return;
        }
        if (!ignoreCancellations) {
            List<String> cancelled = dependencies.stream()
                    .filter(Task::isCancelled)
                    .map(Task::name)
                    .toList();
            if (!cancelled.isEmpty()) {
                completion.accept(ConditionResult.failed(CATEGORY, "dependencies cancelled: " + String.join(", ", cancelled)));
                return;
            }
        }
        completion.accept(ConditionResult.satisfied());
    }
}
