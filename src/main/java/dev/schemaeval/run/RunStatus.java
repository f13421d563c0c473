package dev.schemaeval.run;

/** Lifecycle of a test run. Transitions only move forward. */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(RunStatus next) {
        switch (this) {
            case PENDING:
                return next == RUNNING || next == FAILED;
            case RUNNING:
                return next == COMPLETED || next == FAILED;
            default:
                return false;
        }
    }
}
