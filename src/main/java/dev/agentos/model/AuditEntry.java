package dev.agentos.model;

import java.time.Instant;
import java.util.Locale;

/**
 * One immutable line of the audit trail.
 */
public record AuditEntry(
    Instant timestamp,
    String runId,          // nullable outside a workflow run
    String actor,
    String action,
    String outcome,
    Decision decision,     // nullable unless the entry records a permission check
    String detail
) {
    public static final String PERMISSION_CHECK = "permission.check";

    public enum Decision {
        ALLOW,
        DENY
    }

    public static AuditEntry of(String runId, String actor, String action, String outcome, String detail) {
        return new AuditEntry(Instant.now(), runId, actor, action, outcome, null, detail);
    }

    public static AuditEntry permission(String runId, String actor, Decision decision, String detail) {
        return new AuditEntry(Instant.now(), runId, actor, PERMISSION_CHECK, decision.name().toLowerCase(Locale.ROOT),
            decision, detail);
    }
}
