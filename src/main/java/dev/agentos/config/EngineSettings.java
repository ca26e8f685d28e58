package dev.agentos.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Coordinator-wide settings. Relative paths resolve against {@code projectRoot}.
 */
public record EngineSettings(
    int maxConcurrent,
    Duration defaultTimeout,
    Path projectRoot,
    Path agentsDir,
    Path workflowsDir,
    Path auditLog          // nullable: audit trail kept in memory only
) {
    public static final int DEFAULT_MAX_CONCURRENT = 5;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);
    public static final String DEFAULT_AGENTS_DIR = "agents";
    public static final String DEFAULT_WORKFLOWS_DIR = "workflows";
    public static final String DEFAULT_AUDIT_LOG = "agent-os-audit.jsonl";

    public static EngineSettings defaults() {
        return defaults(Path.of("."));
    }

    public static EngineSettings defaults(Path projectRoot) {
        return new EngineSettings(DEFAULT_MAX_CONCURRENT, DEFAULT_TIMEOUT, projectRoot,
            Path.of(DEFAULT_AGENTS_DIR), Path.of(DEFAULT_WORKFLOWS_DIR), Path.of(DEFAULT_AUDIT_LOG));
    }

    public Path resolvedRoot() {
        return projectRoot.toAbsolutePath().normalize();
    }

    public Path resolvedAgentsDir() {
        return resolvedRoot().resolve(agentsDir);
    }

    public Path resolvedWorkflowsDir() {
        return resolvedRoot().resolve(workflowsDir);
    }

    public Path resolvedAuditLog() {
        return auditLog == null ? null : resolvedRoot().resolve(auditLog);
    }

    public EngineSettings withMaxConcurrent(int value) {
        return new EngineSettings(value, defaultTimeout, projectRoot, agentsDir, workflowsDir, auditLog);
    }

    public EngineSettings withDefaultTimeout(Duration value) {
        return new EngineSettings(maxConcurrent, value, projectRoot, agentsDir, workflowsDir, auditLog);
    }

    public EngineSettings withAuditLog(Path value) {
        return new EngineSettings(maxConcurrent, defaultTimeout, projectRoot, agentsDir, workflowsDir, value);
    }
}
