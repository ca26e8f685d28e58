package dev.agentos.model;

import java.util.List;

/**
 * A named, versioned graph of steps.
 */
public record WorkflowDefinition(
    String name,
    String version,
    String description,
    List<Step> steps,
    Integer maxConcurrent  // nullable, engine setting applies
) {
    public static final String DEFAULT_VERSION = "1.0.0";

    public WorkflowDefinition {
        if (version == null || version.isBlank()) {
            version = DEFAULT_VERSION;
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static WorkflowDefinition of(String name, List<Step> steps) {
        return new WorkflowDefinition(name, DEFAULT_VERSION, null, steps, null);
    }
}
