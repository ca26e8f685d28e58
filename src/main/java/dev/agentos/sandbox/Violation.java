package dev.agentos.sandbox;

import java.time.Instant;

/**
 * A recorded sandbox denial, kept for the security report.
 */
public record Violation(
    Instant timestamp,
    String agentName,
    String type,
    Operation operation,
    String path,
    String details
) {}
