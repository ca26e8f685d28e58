package dev.agentos.coordination;

import dev.agentos.model.PriorityTier;

import java.util.List;

/**
 * Write targets a step declares before its wave is dispatched.
 *
 * @param order declaration order of the step within its workflow
 */
public record WriteClaim(String stepId, PriorityTier priority, int order, List<String> targets) {

    public WriteClaim {
        targets = List.copyOf(targets);
    }
}
