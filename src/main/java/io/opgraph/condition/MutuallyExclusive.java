package io.opgraph.condition;

import io.opgraph.task.Task;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Marks a category as mutually exclusive: no two tasks carrying it execute at the same
 * time, and they execute in submission order.
 *
 * <p>{@link #category(String)} creates a standalone marker that always evaluates
 * satisfied; {@link #wrap(Condition)} makes an existing condition exclusive on its own
 * category while keeping its dependency and verdict.
 */
public final class MutuallyExclusive implements Condition {
    private final String category;
    private final Condition condition;

    private MutuallyExclusive(String category, Condition condition) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("exclusivity category cannot be empty");
        }
        this.category = category.trim();
        this.condition = condition;
    }

    public static MutuallyExclusive category(String category) {
        return new MutuallyExclusive(category, null);
    }

    public static MutuallyExclusive wrap(Condition condition) {
        Objects.requireNonNull(condition, "condition");
        return new MutuallyExclusive(condition.exclusivityCategory(), condition);
    }

    @Override
    public String category() {
        return condition == null ? "MutuallyExclusive<" + category + ">" : condition.category();
    }

    @Override
    public boolean isMutuallyExclusive() {
        return true;
    }

    @Override
    public String exclusivityCategory() {
        return category;
    }

    @Override
    public Optional<Task> dependency(Task task) {
        return condition == null ? Optional.empty() : condition.dependency(task);
    }

    @Override
    public void evaluate(Task task, Consumer<ConditionResult> completion) {
        if (condition == null) {
            completion.accept(ConditionResult.satisfied());
            return;
        }
        condition.evaluate(task, completion);
    }

    @Override
    public String toString() {
        return "MutuallyExclusive[" + category + "]";
    }
}
