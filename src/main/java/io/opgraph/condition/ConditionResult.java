package io.opgraph.condition;

import java.util.Objects;

public record ConditionResult(Throwable error) {
    private static final ConditionResult SATISFIED = new ConditionResult(null);

    public static ConditionResult satisfied() {
        return SATISFIED;
    }

    public static ConditionResult failed(Throwable error) {
        return new ConditionResult(Objects.requireNonNull(error, "error"));
    }

    public static ConditionResult failed(String category, String message) {
        return failed(new ConditionFailedException(category, message));
    }

    public boolean isSatisfied() {
        return error == null;
    }
}
