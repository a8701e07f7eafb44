package io.opgraph.condition;

import io.opgraph.task.Task;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A condition backed by a predicate on the guarded task. A false result or an exception
 * from the predicate vetoes the task.
 */
public final class BlockCondition implements Condition {
    private final String category;
    private final Predicate<Task> predicate;

    public BlockCondition(String category, Predicate<Task> predicate) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("condition category cannot be empty");
        }
        this.category = category.trim();
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public String category() {
        return category;
    }

    @Override
    public void evaluate(Task task, Consumer<ConditionResult> completion) {
        boolean passed;
        try {
            passed = predicate.test(task);
        } catch (RuntimeException e) {
            completion.accept(ConditionResult.failed(e));
            return;
        }
        completion.accept(passed
                ? ConditionResult.satisfied()
                : ConditionResult.failed(category, "block condition " + category + " returned false"));
    }
}
