package io.opgraph.condition;

import io.opgraph.task.Task;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Inverts the verdict of another condition. The wrapped dependency and exclusivity are
 * kept as they are.
 */
public final class NegatedCondition implements Condition {
    private final Condition condition;

    public NegatedCondition(Condition condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    @Override
    public String category() {
        return "Not<" + condition.category() + ">";
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
        return condition.dependency(task);
    }

    @Override
    public void evaluate(Task task, Consumer<ConditionResult> completion) {
        condition.evaluate(task, result -> completion.accept(result.isSatisfied()
                ? ConditionResult.failed(category(), "negated condition " + condition.category() + " was satisfied")
                : ConditionResult.satisfied()));
    }

    public Condition negated() {
        return condition;
    }
}
