package dev.agentos.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.agentos.error.ConfigException;
import dev.agentos.model.RetryPolicy;
import dev.agentos.model.Step;
import dev.agentos.model.WorkflowDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads workflow definitions from YAML. Structural problems (missing ids, cycles, ...)
 * are left to {@link WorkflowValidator}.
 */
public final class WorkflowLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    private WorkflowLoader() {}

    public static WorkflowDefinition loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseWorkflow(root, path.getFileName().toString());
    }

    public static WorkflowDefinition loadFromString(String yaml) throws IOException {
        JsonNode root = MAPPER.readTree(yaml);
        return parseWorkflow(root, "<inline>");
    }

    /**
     * Load every {@code .yaml}/{@code .yml} workflow in a directory, sorted by file name.
     * Returns an empty list when the directory does not exist.
     */
    public static List<WorkflowDefinition> loadFromDirectory(Path dir) throws IOException {
        var workflows = new ArrayList<WorkflowDefinition>();
        if (!Files.isDirectory(dir)) {
            return workflows;
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(p -> {
                String name = p.getFileName().toString();
                return name.endsWith(".yaml") || name.endsWith(".yml");
            }).sorted().toList();
        }
        for (Path file : files) {
            workflows.add(loadFromFile(file));
        }
        return workflows;
    }

    private static WorkflowDefinition parseWorkflow(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ConfigException("Workflow %s is not a mapping".formatted(source));
        }
        String name = text(root, "name");
        String version = text(root, "version");
        String description = text(root, "description");
        Integer maxConcurrent = root.hasNonNull("max_concurrent") ? root.get("max_concurrent").asInt() : null;

        var steps = new ArrayList<Step>();
        JsonNode stepsNode = root.get("steps");
        if (stepsNode != null && stepsNode.isArray()) {
            stepsNode.forEach(node -> steps.add(parseStep(node)));
        } else if (stepsNode != null && !stepsNode.isNull()) {
            throw new ConfigException("Workflow %s: 'steps' must be a list".formatted(source));
        }
        return new WorkflowDefinition(name, version, description, steps, maxConcurrent);
    }

    private static Step parseStep(JsonNode node) {
        String id = text(node, "id");
        String guard = text(node, "guard");
        if (guard == null) {
            guard = text(node, "condition");
        }
        Map<String, Object> inputs = node.hasNonNull("inputs")
            ? MAPPER.convertValue(node.get("inputs"), new TypeReference<LinkedHashMap<String, Object>>() {})
            : Map.of();
        boolean required = !node.hasNonNull("required") || node.get("required").asBoolean();

        return new Step(id, text(node, "agent"), text(node, "action"), inputs, strings(node.get("depends_on")),
            guard, text(node, "output_key"), required, parseRetry(node.get("retry")), strings(node.get("writes")));
    }

    private static RetryPolicy parseRetry(JsonNode node) {
        if (node == null || node.isNull()) {
            return RetryPolicy.none();
        }
        int count = node.hasNonNull("count") ? node.get("count").asInt() : 0;
        long backoffSeconds = node.hasNonNull("backoff_seconds") ? node.get("backoff_seconds").asLong() : 0;
        return new RetryPolicy(count, Duration.ofSeconds(backoffSeconds));
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static List<String> strings(JsonNode node) {
        var values = new ArrayList<String>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(v -> values.add(v.asText()));
        } else {
            values.add(node.asText());
        }
        return values;
    }
}
