package dev.agentos.engine;

import dev.agentos.error.ConfigException;
import dev.agentos.model.Step;
import dev.agentos.model.WorkflowDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Topologically sorts a workflow's steps. Ties are broken by declaration order so
 * the same definition always yields the same plan.
 */
public final class WorkflowPlanner {

    private WorkflowPlanner() {}

    /**
     * @throws ConfigException if the dependency graph contains a cycle
     */
    public static ExecutionPlan plan(WorkflowDefinition workflow) {
        Map<String, Step> steps = new LinkedHashMap<>();
        workflow.steps().forEach(s -> steps.put(s.id(), s));

        Map<String, Integer> level = new HashMap<>();
        List<String> order = new ArrayList<>();
        Set<String> done = new LinkedHashSet<>();

        // Kahn's algorithm, one level per pass
        while (done.size() < steps.size()) {
            var ready = new ArrayList<String>();
            for (Step step : steps.values()) {
                if (!done.contains(step.id()) && knownDeps(step, steps).stream().allMatch(done::contains)) {
                    ready.add(step.id());
                }
            }
            if (ready.isEmpty()) {
                throw new ConfigException("Dependency cycle detected: " + String.join(" -> ", findCycle(steps, done)));
            }
            for (String id : ready) {
                int lvl = 0;
                for (String dep : knownDeps(steps.get(id), steps)) {
                    lvl = Math.max(lvl, level.get(dep) + 1);
                }
                level.put(id, lvl);
                order.add(id);
            }
            done.addAll(ready);
        }

        List<List<String>> levels = new ArrayList<>();
        for (String id : order) {
            int lvl = level.get(id);
            while (levels.size() <= lvl) {
                levels.add(new ArrayList<>());
            }
            levels.get(lvl).add(id);
        }

        Map<String, Set<String>> ancestors = new HashMap<>();
        for (String id : order) {
            var set = new LinkedHashSet<String>();
            for (String dep : knownDeps(steps.get(id), steps)) {
                set.add(dep);
                set.addAll(ancestors.get(dep));
            }
            ancestors.put(id, Collections.unmodifiableSet(set));
        }

        return new ExecutionPlan(List.copyOf(order), levels.stream().map(List::copyOf).toList(), Map.copyOf(ancestors));
    }

    private static List<String> knownDeps(Step step, Map<String, Step> steps) {
        return step.dependsOn().stream().filter(steps::containsKey).toList();
    }

    private static List<String> findCycle(Map<String, Step> steps, Set<String> done) {
        // Every unresolved step has an unresolved dependency, so walking them must revisit a step
        var path = new ArrayList<String>();
        var seen = new HashMap<String, Integer>();
        String current = steps.keySet().stream().filter(id -> !done.contains(id)).findFirst().orElseThrow();
        while (!seen.containsKey(current)) {
            seen.put(current, path.size());
            path.add(current);
            current = knownDeps(steps.get(current), steps).stream()
                .filter(d -> !done.contains(d))
                .findFirst()
                .orElseThrow();
        }
        var cycle = new ArrayList<>(path.subList(seen.get(current), path.size()));
        cycle.add(current);
        return cycle;
    }
}
