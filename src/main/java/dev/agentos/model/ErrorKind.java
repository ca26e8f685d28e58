package dev.agentos.model;

/**
 * Classification of every failure the coordinator reports.
 */
public enum ErrorKind {
    CONFIG(false),
    NOT_FOUND(false),
    PERMISSION_VIOLATION(false),
    RESOURCE_CONFLICT(false),
    TIMEOUT(true),
    AGENT_INTERNAL_ERROR(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /** Whether a step failing with this kind may be re-invoked under its retry budget. */
    public boolean retryable() {
        return retryable;
    }
}
