package io.opgraph.condition;

import io.opgraph.task.Task;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Keeps the verdict of another condition but suppresses its dependency, so the condition
 * is checked without triggering whatever would satisfy it. Failures are reported
 * unchanged.
 */
public final class SilentCondition implements Condition {
    private final Condition condition;

    public SilentCondition(Condition condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    @Override
    public String category() {
        return "Silent<" + condition.category() + ">";
    }

    @Override
    public boolean isMutuallyExclusive() {
        return condition.isMutuallyExclusive();
    }

    @Override
    public String exclusivityCategory() {
        return condition.exclusivityCategory();
    }

    @Override
    public Optional<Task> dependency(Task task) {
        return Optional.empty();
    }

    @Override
    public void evaluate(Task task, Consumer<ConditionResult> completion) {
        condition.evaluate(task, completion);
    }

    public Condition silenced() {
        return condition;
    }
}
