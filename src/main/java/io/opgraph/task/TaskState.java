package io.opgraph.task;

public enum TaskState {
    INITIALIZED,
    PENDING,
    EVALUATING_CONDITIONS,
    READY,
    EXECUTING,
    FINISHING,
    FINISHED;

    public boolean isTerminal() {
        return this == FINISHED;
    }

    boolean canTransitionTo(TaskState next) {
        return switch (this) {
            case INITIALIZED -> next == PENDING;
            case PENDING -> next == EVALUATING_CONDITIONS || next == FINISHING;
            case EVALUATING_CONDITIONS -> next == READY || next == FINISHING;
            case READY -> next == EXECUTING || next == FINISHING;
            case EXECUTING -> next == FINISHING;
            case FINISHING -> next == FINISHED;
            case FINISHED -> false;
        };
    }
}
