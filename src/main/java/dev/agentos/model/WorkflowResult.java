package dev.agentos.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregated outcome of a workflow run. Lists every step in declaration order.
 */
public record WorkflowResult(
    String runId,
    String workflow,
    String version,
    WorkflowState state,
    String reason,
    List<StepReport> steps,
    Map<String, Object> context,
    Instant startedAt,
    Duration duration
) {
    public WorkflowResult {
        steps = List.copyOf(steps);
        context = Map.copyOf(context);
    }

    public Optional<StepReport> step(String stepId) {
        return steps.stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }

    /**
     * True only when the run completed, i.e. no required step ultimately failed.
     */
    public boolean allRequiredSucceeded() {
        return state == WorkflowState.COMPLETED;
    }
}
