package dev.agentos.engine;

import dev.agentos.audit.AuditLog;
import dev.agentos.coordination.CoordinationHub;
import dev.agentos.coordination.ExecutionContext;
import dev.agentos.model.WorkflowDefinition;
import dev.agentos.model.WorkflowState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable state of one workflow execution. Owns the run's {@link ExecutionContext}
 * (through its hub) and the run-scoped attempt counters.
 */
public final class WorkflowRun {

    private final String runId;
    private final WorkflowDefinition workflow;
    private final Map<String, Object> parameters;
    private final CoordinationHub hub;
    private final Map<String, Integer> attempts = new ConcurrentHashMap<>();
    private final List<WorkflowState> history = new ArrayList<>();
    private volatile WorkflowState state;
    private volatile boolean cancelRequested;
    private volatile boolean callerInterrupted;
    private Instant startedAt;

    WorkflowRun(WorkflowDefinition workflow, Map<String, Object> parameters, AuditLog audit) {
        this.runId = UUID.randomUUID().toString();
        this.workflow = workflow;
        this.parameters = Map.copyOf(parameters);
        this.hub = new CoordinationHub(runId, new ExecutionContext(), audit);
        this.state = WorkflowState.PENDING;
        this.history.add(WorkflowState.PENDING);
    }

    public String runId() { return runId; }
    public WorkflowDefinition workflow() { return workflow; }
    public Map<String, Object> parameters() { return parameters; }
    public WorkflowState state() { return state; }
    public boolean isCancelRequested() { return cancelRequested; }

    CoordinationHub hub() { return hub; }
    Instant startedAt() { return startedAt; }

    public synchronized List<WorkflowState> stateHistory() {
        return List.copyOf(history);
    }

    /**
     * Request cooperative cancellation. Running steps finish; nothing new is scheduled.
     * Has no effect once the run has completed or failed.
     */
    public void cancel() {
        if (!state.terminal()) {
            cancelRequested = true;
        }
    }

    boolean callerInterrupted() { return callerInterrupted; }

    void markCallerInterrupted() {
        callerInterrupted = true;
    }

    public int attempts(String stepId) {
        return attempts.getOrDefault(stepId, 0);
    }

    int recordAttempt(String stepId) {
        return attempts.merge(stepId, 1, Integer::sum);
    }

    synchronized void transitionTo(WorkflowState next) {
        if (next == WorkflowState.PLANNING) {
            startedAt = Instant.now();
        }
        this.state = next;
        history.add(next);
    }
}
