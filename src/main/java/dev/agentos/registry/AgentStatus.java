package dev.agentos.registry;

import dev.agentos.audit.AuditActions;
import dev.agentos.model.AuditEntry;

import java.time.Instant;
import java.util.List;

/**
 * Last-known health of a registered agent, derived from the audit trail.
 */
public record AgentStatus(
    String name,
    boolean available,     // an implementation is bound to the agent
    int invocations,
    int failures,
    String lastOutcome,    // null if never invoked
    Instant lastInvokedAt  // null if never invoked
) {
    /**
     * Summarise the {@code agent.invoke} entries recorded for {@code name}.
     */
    public static AgentStatus fromAudit(String name, boolean available, List<AuditEntry> entries) {
        int invocations = 0;
        int failures = 0;
        String lastOutcome = null;
        Instant lastAt = null;
        for (AuditEntry entry : entries) {
            if (!name.equals(entry.actor()) || !AuditActions.AGENT_INVOKE.equals(entry.action())) {
                continue;
            }
            invocations++;
            if (!"success".equals(entry.outcome())) {
                failures++;
            }
            if (lastAt == null || !entry.timestamp().isBefore(lastAt)) {
                lastAt = entry.timestamp();
                lastOutcome = entry.outcome();
            }
        }
        return new AgentStatus(name, available, invocations, failures, lastOutcome, lastAt);
    }
}
