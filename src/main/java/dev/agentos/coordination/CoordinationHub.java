package dev.agentos.coordination;

import dev.agentos.agent.WriteGuard;
import dev.agentos.audit.AuditActions;
import dev.agentos.audit.AuditLog;
import dev.agentos.error.ResourceConflictException;
import dev.agentos.model.AuditEntry;
import dev.agentos.model.Step;
import dev.agentos.model.StepReport;
import dev.agentos.model.StepState;
import dev.agentos.model.WorkflowDefinition;
import dev.agentos.model.WorkflowResult;
import dev.agentos.model.WorkflowState;
import dev.agentos.sandbox.GlobMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Single writer of a run's {@link ExecutionContext}. Also arbitrates write targets
 * within a wave and assembles the final {@link WorkflowResult}.
 * One hub exists per workflow run.
 */
public final class CoordinationHub {

    private static final Logger log = LoggerFactory.getLogger(CoordinationHub.class);

    private final String runId;
    private final ExecutionContext context;
    private final AuditLog audit;
    private final Map<String, StepReport> reports = new HashMap<>();
    // target (path or glob) -> holding step, cleared at every wave boundary
    private final Map<String, String> writeLeases = new LinkedHashMap<>();

    public CoordinationHub(String runId, ExecutionContext context, AuditLog audit) {
        this.runId = runId;
        this.context = context;
        this.audit = audit;
    }

    public ExecutionContext context() {
        return context;
    }

    /**
     * Record a step's terminal report and, if it succeeded with a payload, publish an
     * immutable copy of the payload under the step's output key. Failed and skipped steps
     * leave the key absent.
     *
     * @throws IllegalArgumentException if the payload cannot be represented as JSON;
     *                                  nothing is recorded
     */
    public synchronized void publish(Step step, StepReport report) {
        if (report.state() == StepState.SUCCEEDED && report.result().payload() != null) {
            Object frozen = Payloads.freeze(report.result().payload());
            reports.put(step.id(), report);
            context.put(step.outputKey(), frozen);
            audit.append(AuditEntry.of(runId, AuditActions.COORDINATOR, AuditActions.CONTEXT_PUBLISH, "ok",
                "%s -> %s".formatted(step.id(), step.outputKey())));
            log.debug("Published [{}] under key [{}]", step.id(), step.outputKey());
        } else {
            reports.put(step.id(), report);
            String action = report.state() == StepState.SUCCEEDED || report.state() == StepState.FAILED
                ? AuditActions.CONTEXT_PUBLISH : AuditActions.STEP_SKIP;
            audit.append(AuditEntry.of(runId, AuditActions.COORDINATOR, action,
                report.state().name().toLowerCase(Locale.ROOT),
                "%s: %s".formatted(step.id(), report.reason() == null ? "no payload" : report.reason())));
        }
    }

    public synchronized boolean isReported(String stepId) {
        return reports.containsKey(stepId);
    }

    public synchronized StepReport report(String stepId) {
        return reports.get(stepId);
    }

    /**
     * Grant the declared write targets of one wave. Claims are considered in priority
     * order, then declaration order; a claim overlapping a target already granted to
     * another step loses.
     *
     * @return losing step id -> conflict message
     */
    public synchronized Map<String, String> resolveConflicts(List<WriteClaim> claims) {
        var ordered = new ArrayList<>(claims);
        ordered.sort(Comparator.<WriteClaim>comparingInt(c -> c.priority().rank())
            .thenComparingInt(WriteClaim::order));

        Map<String, String> losers = new LinkedHashMap<>();
        for (WriteClaim claim : ordered) {
            String conflict = null;
            for (String target : claim.targets()) {
                String holder = holderOf(target, claim.stepId());
                if (holder != null) {
                    conflict = "Write target '%s' granted to higher-priority step '%s'".formatted(target, holder);
                    break;
                }
            }
            if (conflict != null) {
                losers.put(claim.stepId(), conflict);
                audit.append(AuditEntry.of(runId, AuditActions.COORDINATOR, AuditActions.CONFLICT_RESOLVE,
                    "denied", claim.stepId() + ": " + conflict));
                log.warn("Step [{}] lost write conflict: {}", claim.stepId(), conflict);
            } else {
                for (String target : claim.targets()) {
                    writeLeases.put(target, claim.stepId());
                }
                if (!claim.targets().isEmpty()) {
                    audit.append(AuditEntry.of(runId, AuditActions.COORDINATOR, AuditActions.CONFLICT_RESOLVE,
                        "granted", claim.stepId() + ": " + claim.targets()));
                }
            }
        }
        return losers;
    }

    /**
     * Guard for runtime writes of {@code stepId}: a path leased by another step of the
     * current wave is refused, any other path is leased to this step.
     */
    public WriteGuard writeGuardFor(String stepId) {
        return path -> acquire(path, stepId);
    }

    private synchronized void acquire(String path, String stepId) {
        String holder = holderOf(path, stepId);
        if (holder != null) {
            audit.append(AuditEntry.of(runId, AuditActions.COORDINATOR, AuditActions.CONFLICT_RESOLVE,
                "denied", "%s: runtime write to %s held by %s".formatted(stepId, path, holder)));
            throw new ResourceConflictException(path, holder);
        }
        writeLeases.putIfAbsent(path, stepId);
    }

    private String holderOf(String target, String requester) {
        for (var lease : writeLeases.entrySet()) {
            if (!lease.getValue().equals(requester) && GlobMatcher.overlaps(lease.getKey(), target)) {
                return lease.getValue();
            }
        }
        return null;
    }

    /**
     * Release all write leases at the end of a wave.
     */
    public synchronized void endWave() {
        writeLeases.clear();
    }

    /**
     * Merge every step report with the run's final state. Destroys the context;
     * the result keeps a copy of its final contents.
     */
    public synchronized WorkflowResult aggregate(WorkflowDefinition definition, WorkflowState state, String reason,
                                                 Instant startedAt) {
        var steps = new ArrayList<StepReport>();
        for (Step step : definition.steps()) {
            StepReport report = reports.get(step.id());
            steps.add(report != null ? report : StepReport.skipped(step, "Not reached"));
        }
        Map<String, Object> finalContext = context.snapshot();
        context.destroy();
        return new WorkflowResult(runId, definition.name(), definition.version(), state, reason, steps,
            finalContext, startedAt, Duration.between(startedAt, Instant.now()));
    }
}
