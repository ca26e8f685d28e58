package dev.agentos.engine;

import dev.agentos.error.ConfigException;
import dev.agentos.model.Step;
import dev.agentos.model.WorkflowDefinition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates workflow definitions before execution.
 */
public final class WorkflowValidator {

    private WorkflowValidator() {}

    /**
     * Validate a workflow definition. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(WorkflowDefinition workflow) {
        var errors = new ArrayList<String>();

        if (workflow.name() == null || workflow.name().isBlank()) {
            errors.add("Workflow has missing or empty name");
        }
        if (workflow.steps().isEmpty()) {
            errors.add("Workflow '%s' has no steps".formatted(workflow.name()));
        }
        if (workflow.maxConcurrent() != null && workflow.maxConcurrent() < 1) {
            errors.add("Workflow '%s': max_concurrent must be at least 1".formatted(workflow.name()));
        }

        Set<String> ids = new HashSet<>();
        Map<String, String> producers = new HashMap<>();   // output key -> step id
        for (Step step : workflow.steps()) {
            if (step.id() == null || step.id().isBlank()) {
                errors.add("Step has missing or empty id");
                continue;
            }
            if (!ids.add(step.id())) {
                errors.add("Duplicate step id '%s'".formatted(step.id()));
            }
            String previous = producers.putIfAbsent(step.outputKey(), step.id());
            if (previous != null && !previous.equals(step.id())) {
                errors.add("Steps '%s' and '%s' share output key '%s'".formatted(previous, step.id(), step.outputKey()));
            }
            if (step.agent() == null || step.agent().isBlank()) {
                errors.add("Step '%s' has missing agent".formatted(step.id()));
            }
            if (step.action() == null || step.action().isBlank()) {
                errors.add("Step '%s' has missing action".formatted(step.id()));
            }
            if (step.retry().count() < 0 || step.retry().backoff().isNegative()) {
                errors.add("Step '%s' has negative retry count or backoff".formatted(step.id()));
            }
        }

        for (Step step : workflow.steps()) {
            for (String dep : step.dependsOn()) {
                if (dep.equals(step.id())) {
                    errors.add("Step '%s' depends on itself".formatted(step.id()));
                } else if (!ids.contains(dep)) {
                    errors.add("Step '%s' depends on unknown step '%s'".formatted(step.id(), dep));
                }
            }
        }
        if (!errors.isEmpty()) {
            return errors;
        }

        ExecutionPlan plan;
        try {
            plan = WorkflowPlanner.plan(workflow);
        } catch (ConfigException e) {
            errors.addAll(e.problems());
            return errors;
        }

        for (Step step : workflow.steps()) {
            if (step.hasGuard()) {
                try {
                    GuardExpression guard = GuardExpression.parse(step.guard());
                    for (String identifier : guard.identifiers()) {
                        checkReference(step, identifier.split("\\.")[0], "guard", producers, plan, errors);
                    }
                } catch (IllegalArgumentException e) {
                    errors.add("Step '%s' has invalid guard: %s".formatted(step.id(), e.getMessage()));
                }
            }
            for (String key : InputBinder.referencedKeys(step.inputs())) {
                checkReference(step, key, "input", producers, plan, errors);
            }
        }
        return errors;
    }

    /**
     * @throws ConfigException carrying every problem found
     */
    public static void requireValid(WorkflowDefinition workflow) {
        List<String> errors = validate(workflow);
        if (!errors.isEmpty()) {
            throw new ConfigException(errors);
        }
    }

    // A key produced by a step that is not an ancestor would read ahead of the wave order
    private static void checkReference(Step step, String key, String where, Map<String, String> producers,
                                       ExecutionPlan plan, List<String> errors) {
        String producer = producers.get(key);
        if (producer != null && !plan.isAncestor(producer, step.id())) {
            errors.add("Step '%s' %s references '%s', produced by non-ancestor step '%s'"
                .formatted(step.id(), where, key, producer));
        }
    }
}
