package dev.agentos.model;

/**
 * Terminal record of one step: what happened, why, and how many attempts it took.
 */
public record StepReport(
    String stepId,
    String agent,
    StepState state,
    int wave,              // -1 when the step never joined a wave
    int attempts,
    ErrorKind errorKind,
    String reason,
    AgentResult result
) {
    public static StepReport skipped(Step step, String reason) {
        return new StepReport(step.id(), step.agent(), StepState.SKIPPED, -1, 0, null, reason,
            AgentResult.skipped(reason));
    }
}
