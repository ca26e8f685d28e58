package dev.agentos.audit;

import dev.agentos.model.AuditEntry;

/**
 * Action names written to the audit trail.
 */
public final class AuditActions {

    public static final String SESSION_OPEN = "session.open";
    public static final String SESSION_CLOSE = "session.close";
    public static final String PERMISSION_CHECK = AuditEntry.PERMISSION_CHECK;
    public static final String AGENT_INVOKE = "agent.invoke";
    public static final String CONTEXT_PUBLISH = "context.publish";
    public static final String CONFLICT_RESOLVE = "conflict.resolve";
    public static final String STEP_SKIP = "step.skip";
    public static final String STEP_RETRY = "step.retry";
    public static final String WORKFLOW_STATE = "workflow.state";

    public static final String COORDINATOR = "coordinator";

    private AuditActions() {}
}
