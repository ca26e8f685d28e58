package dev.agentos.model;

import java.util.List;
import java.util.Map;

/**
 * One node of a workflow: an agent action plus its dependencies and gating rules.
 */
public record Step(
    String id,
    String agent,
    String action,
    Map<String, Object> inputs,
    List<String> dependsOn,
    String guard,          // nullable, boolean expression over context
    String outputKey,
    boolean required,
    RetryPolicy retry,
    List<String> writes    // declared write targets, empty = derive from agent manifest
) {
    public Step {
        inputs = inputs == null ? Map.of() : inputs;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        if (outputKey == null || outputKey.isBlank()) {
            outputKey = id;
        }
        if (retry == null) {
            retry = RetryPolicy.none();
        }
        writes = writes == null ? List.of() : List.copyOf(writes);
    }

    /**
     * Required step without guard, retry or declared writes.
     */
    public static Step of(String id, String agent, String action, List<String> dependsOn) {
        return new Step(id, agent, action, Map.of(), dependsOn, null, id, true, RetryPolicy.none(), List.of());
    }

    public boolean hasGuard() {
        return guard != null && !guard.isBlank();
    }
}
