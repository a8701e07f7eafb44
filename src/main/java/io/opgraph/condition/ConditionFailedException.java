package io.opgraph.condition;

public final class ConditionFailedException extends RuntimeException {
    private final String category;

    public ConditionFailedException(String category, String message) {
        super(message);
        this.category = category;
    }

    public String category() {
        return category;
    }
}
