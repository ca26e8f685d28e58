package dev.agentos.engine;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static shape of a workflow: a topological order, the dependency levels a run
 * would follow if no step were skipped, and every step's ancestors.
 */
public record ExecutionPlan(
    List<String> order,
    List<List<String>> levels,
    Map<String, Set<String>> ancestors
) {
    public Set<String> ancestorsOf(String stepId) {
        return ancestors.getOrDefault(stepId, Set.of());
    }

    public boolean isAncestor(String ancestor, String stepId) {
        return ancestorsOf(stepId).contains(ancestor);
    }
}
