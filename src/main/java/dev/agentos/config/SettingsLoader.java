package dev.agentos.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.agentos.error.ConfigException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Reads {@link EngineSettings} from an optional YAML file:
 *
 * <pre>
 * max_concurrent: 5
 * default_timeout_seconds: 300
 * agents_dir: agents
 * workflows_dir: workflows
 * audit_log: agent-os-audit.jsonl   # or null to disable
 * </pre>
 */
public final class SettingsLoader {

    public static final String DEFAULT_FILE = "agent-os.yaml";

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    private SettingsLoader() {}

    /**
     * Load settings for {@code projectRoot}, or return defaults when {@code file} does not exist.
     */
    public static EngineSettings load(Path projectRoot, Path file) throws IOException {
        EngineSettings defaults = EngineSettings.defaults(projectRoot);
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        JsonNode root = MAPPER.readTree(file.toFile());
        if (root == null || root.isNull()) {
            return defaults;
        }
        if (!root.isObject()) {
            throw new ConfigException("Settings file %s is not a mapping".formatted(file));
        }

        int maxConcurrent = root.hasNonNull("max_concurrent")
            ? root.get("max_concurrent").asInt() : defaults.maxConcurrent();
        if (maxConcurrent < 1) {
            throw new ConfigException("max_concurrent must be at least 1 in " + file);
        }
        Duration timeout = root.hasNonNull("default_timeout_seconds")
            ? Duration.ofSeconds(root.get("default_timeout_seconds").asLong()) : defaults.defaultTimeout();
        if (timeout.isZero() || timeout.isNegative()) {
            throw new ConfigException("default_timeout_seconds must be positive in " + file);
        }
        Path agentsDir = root.hasNonNull("agents_dir") ? Path.of(root.get("agents_dir").asText()) : defaults.agentsDir();
        Path workflowsDir = root.hasNonNull("workflows_dir")
            ? Path.of(root.get("workflows_dir").asText()) : defaults.workflowsDir();
        Path auditLog = root.has("audit_log")
            ? (root.get("audit_log").isNull() ? null : Path.of(root.get("audit_log").asText()))
            : defaults.auditLog();

        return new EngineSettings(maxConcurrent, timeout, projectRoot, agentsDir, workflowsDir, auditLog);
    }
}
