package dev.agentos.model;

public enum WorkflowState {
    PENDING,
    PLANNING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
