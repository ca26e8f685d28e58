package dev.agentos.engine;

import dev.agentos.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Known workflow definitions by name and version. Lookups without a version return
 * the highest version.
 */
public final class WorkflowCatalog {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCatalog.class);

    static final Comparator<String> VERSION_ORDER = WorkflowCatalog::compareVersions;

    private final Map<String, TreeMap<String, WorkflowDefinition>> workflows = new LinkedHashMap<>();

    public synchronized void register(WorkflowDefinition workflow) {
        workflows.computeIfAbsent(workflow.name(), n -> new TreeMap<>(VERSION_ORDER))
            .put(workflow.version(), workflow);
        log.info("Registered workflow: {} v{}", workflow.name(), workflow.version());
    }

    public synchronized Optional<WorkflowDefinition> get(String name) {
        TreeMap<String, WorkflowDefinition> versions = workflows.get(name);
        return versions == null || versions.isEmpty() ? Optional.empty() : Optional.of(versions.lastEntry().getValue());
    }

    public synchronized Optional<WorkflowDefinition> get(String name, String version) {
        TreeMap<String, WorkflowDefinition> versions = workflows.get(name);
        return versions == null ? Optional.empty() : Optional.ofNullable(versions.get(version));
    }

    public synchronized List<String> names() {
        return List.copyOf(workflows.keySet());
    }

    public synchronized List<String> versions(String name) {
        TreeMap<String, WorkflowDefinition> versions = workflows.get(name);
        return versions == null ? List.of() : new ArrayList<>(versions.keySet());
    }

    /**
     * Compare dotted versions numerically part by part; non-numeric parts compare as text.
     */
    static int compareVersions(String a, String b) {
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        for (int i = 0; i < Math.max(left.length, right.length); i++) {
            String l = i < left.length ? left[i] : "0";
            String r = i < right.length ? right[i] : "0";
            int cmp;
            try {
                cmp = Long.compare(Long.parseLong(l), Long.parseLong(r));
            } catch (NumberFormatException e) {
                cmp = l.compareTo(r);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}
