package dev.agentos.model;

/**
 * Terminal state of a step within a workflow run.
 */
public enum StepState {
    SUCCEEDED,
    FAILED,
    SKIPPED,
    /** A non-required step failed; dependents proceed without its output. */
    SKIPPED_WITH_WARNING;

    public boolean producedOutput() {
        return this == SUCCEEDED;
    }
}
