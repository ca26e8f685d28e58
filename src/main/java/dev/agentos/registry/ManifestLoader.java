package dev.agentos.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.agentos.error.ConfigException;
import dev.agentos.model.AgentDescriptor;
import dev.agentos.model.PermissionManifest;
import dev.agentos.model.PriorityTier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads agent manifests from YAML.
 *
 * <pre>
 * name: code-quality-agent
 * capabilities: [analysis]
 * priority: high
 * permissions:
 *   allow_read: ["src/**"]
 *   allow_write: []
 *   deny: [".git/**"]
 * timeout_seconds: 60
 * </pre>
 *
 * Permission entries are JDK globs over project-relative paths. {@code *} stays within
 * one directory, so {@code "*.md"} covers only top-level markdown files; use
 * {@code "**}{@code /*.md"} for every directory. A leading {@code **}{@code /} also matches
 * at the project root.
 */
public final class ManifestLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    private ManifestLoader() {}

    public static AgentDescriptor loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseManifest(root, path.getFileName().toString());
    }

    public static AgentDescriptor loadFromString(String yaml) throws IOException {
        JsonNode root = MAPPER.readTree(yaml);
        return parseManifest(root, "<inline>");
    }

    /**
     * Load every {@code .yaml}/{@code .yml} manifest in a directory, sorted by file name.
     * Returns an empty list when the directory does not exist.
     */
    public static List<AgentDescriptor> loadFromDirectory(Path dir) throws IOException {
        var descriptors = new ArrayList<AgentDescriptor>();
        if (!Files.isDirectory(dir)) {
            return descriptors;
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(ManifestLoader::isYaml).sorted().toList();
        }
        for (Path file : files) {
            descriptors.add(loadFromFile(file));
        }
        return descriptors;
    }

    static boolean isYaml(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static AgentDescriptor parseManifest(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ConfigException("Manifest %s is not a mapping".formatted(source));
        }
        var problems = new ArrayList<String>();

        String name = text(root, "name");
        if (name == null || name.isBlank()) {
            problems.add("Manifest %s: missing required field 'name'".formatted(source));
        }
        List<String> capabilities = null;
        if (!root.hasNonNull("capabilities")) {
            problems.add("Manifest %s: missing required field 'capabilities'".formatted(source));
        } else {
            capabilities = strings(root.get("capabilities"));
        }
        PermissionManifest permissions = null;
        if (!root.hasNonNull("permissions")) {
            problems.add("Manifest %s: missing required field 'permissions'".formatted(source));
        } else {
            permissions = parsePermissions(root.get("permissions"));
        }

        PriorityTier priority = PriorityTier.NORMAL;
        String priorityText = text(root, "priority");
        if (priorityText != null) {
            try {
                priority = PriorityTier.parse(priorityText);
            } catch (IllegalArgumentException e) {
                problems.add("Manifest %s: invalid priority '%s' (expected high, normal or low)"
                    .formatted(source, priorityText));
            }
        }

        Duration timeout = null;
        if (root.hasNonNull("timeout_seconds")) {
            int seconds = root.get("timeout_seconds").asInt();
            if (seconds <= 0) {
                problems.add("Manifest %s: timeout_seconds must be positive".formatted(source));
            } else {
                timeout = Duration.ofSeconds(seconds);
            }
        }
        int maxOperations = root.hasNonNull("max_operations")
            ? root.get("max_operations").asInt() : AgentDescriptor.DEFAULT_MAX_OPERATIONS;

        if (!problems.isEmpty()) {
            throw new ConfigException(problems);
        }
        return new AgentDescriptor(name, text(root, "kind"), text(root, "description"),
            capabilities, priority, permissions, timeout, maxOperations);
    }

    private static PermissionManifest parsePermissions(JsonNode node) {
        return new PermissionManifest(
            strings(node.get("allow_read")),
            strings(node.get("allow_write")),
            strings(node.get("allow_execute")),
            strings(node.get("deny")));
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
