package dev.agentos.engine;

import dev.agentos.agent.ExecutionUnit;
import dev.agentos.audit.AuditActions;
import dev.agentos.audit.AuditLog;
import dev.agentos.coordination.CoordinationHub;
import dev.agentos.coordination.WriteClaim;
import dev.agentos.error.ConfigException;
import dev.agentos.model.AgentDescriptor;
import dev.agentos.model.AgentResult;
import dev.agentos.model.AuditEntry;
import dev.agentos.model.ErrorKind;
import dev.agentos.model.PriorityTier;
import dev.agentos.model.RetryPolicy;
import dev.agentos.model.Step;
import dev.agentos.model.StepReport;
import dev.agentos.model.StepState;
import dev.agentos.model.WorkflowDefinition;
import dev.agentos.model.WorkflowResult;
import dev.agentos.model.WorkflowState;
import dev.agentos.registry.AgentRegistry;
import dev.agentos.sandbox.GlobMatcher;
import dev.agentos.sandbox.PermissionSandbox;
import dev.agentos.sandbox.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Drives workflow runs: validates the graph, then executes it wave by wave.
 * Steps of one wave run in parallel up to the concurrency limit; a wave starts only
 * after every step of the previous wave has published its result.
 */
public final class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final AgentRegistry registry;
    private final PermissionSandbox sandbox;
    private final ExecutionUnit executionUnit;
    private final AuditLog audit;
    private final int maxConcurrent;

    public WorkflowEngine(AgentRegistry registry, PermissionSandbox sandbox, ExecutionUnit executionUnit,
                          AuditLog audit, int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        this.registry = registry;
        this.sandbox = sandbox;
        this.executionUnit = executionUnit;
        this.audit = audit;
        this.maxConcurrent = maxConcurrent;
    }

    public WorkflowRun newRun(WorkflowDefinition workflow) {
        return newRun(workflow, Map.of());
    }

    public WorkflowRun newRun(WorkflowDefinition workflow, Map<String, Object> parameters) {
        return new WorkflowRun(workflow, parameters, audit);
    }

    public WorkflowResult execute(WorkflowDefinition workflow) {
        return execute(newRun(workflow));
    }

    /**
     * Run {@code run} to a terminal state and return the aggregated result.
     *
     * @throws ConfigException if the definition is invalid; the run never starts
     */
    public WorkflowResult execute(WorkflowRun run) {
        WorkflowDefinition workflow = run.workflow();
        if (run.state() != WorkflowState.PENDING) {
            throw new IllegalStateException("Run %s already started".formatted(run.runId()));
        }
        transition(run, WorkflowState.PLANNING);

        List<String> errors = WorkflowValidator.validate(workflow);
        if (!errors.isEmpty()) {
            transition(run, WorkflowState.FAILED);
            log.warn("Workflow [{}] rejected: {}", workflow.name(), errors);
            throw new ConfigException(errors);
        }
        ExecutionPlan plan = WorkflowPlanner.plan(workflow);

        transition(run, WorkflowState.RUNNING);
        log.info("Starting workflow [{}] v{} run={} steps={}", workflow.name(), workflow.version(),
            run.runId(), workflow.steps().size());

        int concurrency = workflow.maxConcurrent() != null ? workflow.maxConcurrent() : maxConcurrent;
        ExecutorService pool = Executors.newFixedThreadPool(concurrency, ExecutionUnit.daemonThreads("wave-worker"));
        try {
            return drive(run, plan, pool);
        } finally {
            pool.shutdownNow();
            if (run.callerInterrupted()) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private WorkflowResult drive(WorkflowRun run, ExecutionPlan plan, ExecutorService pool) {
        WorkflowDefinition workflow = run.workflow();
        CoordinationHub hub = run.hub();
        Map<String, Integer> declarationOrder = new HashMap<>();
        for (int i = 0; i < workflow.steps().size(); i++) {
            declarationOrder.put(workflow.steps().get(i).id(), i);
        }

        Set<Step> pending = new LinkedHashSet<>(workflow.steps());
        String failure = null;
        int wave = 0;

        while (!pending.isEmpty() && failure == null && !run.isCancelRequested()) {
            if (Thread.interrupted()) {
                interrupted(run);
                break;
            }
            Map<String, Object> snapshot = hub.context().snapshot();
            List<Step> ready = planWave(run, plan, pending, snapshot);
            if (ready.isEmpty()) {
                if (pending.isEmpty()) {
                    break;
                }
                throw new IllegalStateException("No runnable step in acyclic workflow " + workflow.name());
            }
            pending.removeAll(ready);
            ready.sort(Comparator.<Step>comparingInt(s -> priorityOf(s).rank())
                .thenComparingInt(s -> declarationOrder.get(s.id())));

            log.info("Workflow [{}] wave {}: {}", workflow.name(), wave, ready.stream().map(Step::id).toList());
            failure = runWave(run, plan, ready, wave, snapshot, declarationOrder, pool);
            hub.endWave();
            wave++;
        }

        WorkflowState finalState;
        String reason;
        if (failure != null) {
            finalState = WorkflowState.FAILED;
            reason = failure;
            skipAll(run, pending, "Not scheduled: workflow failed");
        } else if (run.isCancelRequested()) {
            finalState = WorkflowState.CANCELLED;
            reason = "Cancelled";
            skipAll(run, pending, "Not scheduled: workflow cancelled");
        } else {
            finalState = WorkflowState.COMPLETED;
            reason = null;
        }
        transition(run, finalState);
        log.info("Workflow [{}] run={} finished {}{}", workflow.name(), run.runId(), finalState,
            reason == null ? "" : ": " + reason);
        return hub.aggregate(workflow, finalState, reason, run.startedAt());
    }

    /**
     * Resolve every pending step whose dependencies are terminal: skip it if its guard is
     * false or it needs an output that was never produced, otherwise put it in the wave.
     * Skips are resolved to a fixpoint so their dependents can join the same wave.
     */
    private List<Step> planWave(WorkflowRun run, ExecutionPlan plan, Set<Step> pending, Map<String, Object> snapshot) {
        CoordinationHub hub = run.hub();
        var ready = new ArrayList<Step>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Step step : new ArrayList<>(pending)) {
                if (ready.contains(step) || !step.dependsOn().stream().allMatch(hub::isReported)) {
                    continue;
                }
                String skip = skipReason(run, plan, step, snapshot);
                if (skip != null) {
                    pending.remove(step);
                    hub.publish(step, StepReport.skipped(step, skip));
                    log.info("Skipping step [{}]: {}", step.id(), skip);
                    changed = true;
                } else {
                    ready.add(step);
                }
            }
        }
        return ready;
    }

    private String skipReason(WorkflowRun run, ExecutionPlan plan, Step step, Map<String, Object> snapshot) {
        CoordinationHub hub = run.hub();
        Set<String> ancestors = plan.ancestorsOf(step.id());
        for (String key : InputBinder.referencedKeys(step.inputs())) {
            Optional<Step> producer = run.workflow().steps().stream()
                .filter(s -> key.equals(s.outputKey()) && ancestors.contains(s.id()))
                .findFirst();
            if (producer.isPresent()) {
                StepReport report = hub.report(producer.get().id());
                if (report == null || !report.state().producedOutput() || report.result().payload() == null) {
                    return "Required output '%s' of step '%s' is absent".formatted(key, producer.get().id());
                }
            }
        }
        if (step.hasGuard()) {
            ContextView view = viewFor(run, plan, step, snapshot);
            if (!GuardExpression.parse(step.guard()).evaluate(view::resolve)) {
                return "Guard '%s' evaluated false".formatted(step.guard());
            }
        }
        return null;
    }

    private ContextView viewFor(WorkflowRun run, ExecutionPlan plan, Step step, Map<String, Object> snapshot) {
        Map<String, Object> values = new LinkedHashMap<>(run.parameters());
        Set<String> ancestors = plan.ancestorsOf(step.id());
        for (Step other : run.workflow().steps()) {
            if (ancestors.contains(other.id()) && snapshot.containsKey(other.outputKey())) {
                values.put(other.outputKey(), snapshot.get(other.outputKey()));
            }
        }
        return ContextView.of(values);
    }

    /**
     * @return the failure reason if a required step failed, else null
     */
    private String runWave(WorkflowRun run, ExecutionPlan plan, List<Step> wave, int waveIndex,
                           Map<String, Object> snapshot, Map<String, Integer> declarationOrder,
                           ExecutorService pool) {
        CoordinationHub hub = run.hub();

        var claims = new ArrayList<WriteClaim>();
        for (Step step : wave) {
            List<String> targets = writeTargets(step);
            if (!targets.isEmpty()) {
                claims.add(new WriteClaim(step.id(), priorityOf(step), declarationOrder.get(step.id()), targets));
            }
        }
        Map<String, String> losers = hub.resolveConflicts(claims);

        var futures = new ArrayList<Future<StepReport>>();
        for (Step step : wave) {
            String conflict = losers.get(step.id());
            if (conflict != null) {
                StepReport report = failed(step, waveIndex, 0,
                    AgentResult.failure(ErrorKind.RESOURCE_CONFLICT, conflict));
                hub.publish(step, report);
                futures.add(CompletableFuture.completedFuture(report));
            } else {
                ContextView view = viewFor(run, plan, step, snapshot);
                futures.add(pool.submit(() -> runStep(run, step, waveIndex, view)));
            }
        }

        String failure = null;
        for (int i = 0; i < futures.size(); i++) {
            Step step = wave.get(i);
            StepReport report;
            try {
                report = awaitStep(run, futures.get(i));
            } catch (ExecutionException e) {
                log.error("Step [{}] crashed the coordinator", step.id(), e.getCause());
                report = failed(step, waveIndex, run.attempts(step.id()),
                    AgentResult.failure(ErrorKind.AGENT_INTERNAL_ERROR, String.valueOf(e.getCause())));
                hub.publish(step, report);
            }
            if (failure == null && report.state() == StepState.FAILED) {
                failure = "Required step '%s' failed: %s".formatted(step.id(), report.reason());
            }
        }
        return failure;
    }

    /**
     * Wait for a dispatched step without giving up on it. An interrupt of the calling
     * thread cancels the run; the step still finishes and publishes its own report.
     */
    private StepReport awaitStep(WorkflowRun run, Future<StepReport> future) throws ExecutionException {
        while (true) {
            try {
                return future.get();
            } catch (InterruptedException e) {
                interrupted(run);
            }
        }
    }

    private void interrupted(WorkflowRun run) {
        if (!run.callerInterrupted()) {
            log.warn("Workflow [{}] run={} interrupted, cancelling", run.workflow().name(), run.runId());
        }
        run.markCallerInterrupted();
        run.cancel();
    }

    private StepReport runStep(WorkflowRun run, Step step, int waveIndex, ContextView view) {
        CoordinationHub hub = run.hub();
        if (run.isCancelRequested()) {
            StepReport report = new StepReport(step.id(), step.agent(), StepState.SKIPPED, waveIndex, 0, null,
                "Workflow cancelled before step started", AgentResult.skipped("Workflow cancelled before step started"));
            hub.publish(step, report);
            return report;
        }

        Optional<AgentDescriptor> descriptor = registry.find(step.agent());
        if (descriptor.isEmpty()) {
            StepReport report = failed(step, waveIndex, 0,
                AgentResult.failure(ErrorKind.NOT_FOUND, "Agent not registered: " + step.agent()));
            hub.publish(step, report);
            return report;
        }

        Map<String, Object> inputs = InputBinder.bind(step.inputs(), view);
        AgentResult result;
        int attempt;
        while (true) {
            attempt = run.recordAttempt(step.id());
            Session session = sandbox.openSession(descriptor.get(), run.runId());
            result = executionUnit.invoke(descriptor.get(), step.action(), inputs, session,
                hub.writeGuardFor(step.id()));
            if (result.succeeded()
                || !result.errorKind().retryable()
                || attempt >= step.retry().maxAttempts()
                || run.isCancelRequested()) {
                break;
            }
            audit.append(AuditEntry.of(run.runId(), AuditActions.COORDINATOR, AuditActions.STEP_RETRY,
                "scheduled", "%s attempt %d after %s".formatted(step.id(), attempt + 1, result.errorKind())));
            log.info("Retrying step [{}] (attempt {} of {}) after {}", step.id(), attempt + 1,
                step.retry().maxAttempts(), result.errorKind());
            if (!sleep(step.retry())) {
                break;
            }
        }

        StepReport report = result.succeeded()
            ? new StepReport(step.id(), step.agent(), StepState.SUCCEEDED, waveIndex, attempt, null, null, result)
            : failed(step, waveIndex, attempt, result);
        try {
            hub.publish(step, report);
        } catch (IllegalArgumentException e) {
            report = failed(step, waveIndex, attempt, AgentResult.failure(ErrorKind.AGENT_INTERNAL_ERROR,
                "Unpublishable output: " + e.getMessage()));
            hub.publish(step, report);
        }
        return report;
    }

    private static boolean sleep(RetryPolicy retry) {
        try {
            Thread.sleep(retry.backoff().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static StepReport failed(Step step, int waveIndex, int attempts, AgentResult result) {
        StepState state = step.required() ? StepState.FAILED : StepState.SKIPPED_WITH_WARNING;
        String reason = "%s: %s".formatted(result.errorKind(), result.message());
        if (!step.required()) {
            log.warn("Optional step [{}] failed, continuing without its output: {}", step.id(), reason);
        }
        return new StepReport(step.id(), step.agent(), state, waveIndex, attempts, result.errorKind(), reason, result);
    }

    private void skipAll(WorkflowRun run, Set<Step> steps, String reason) {
        for (Step step : steps) {
            run.hub().publish(step, StepReport.skipped(step, reason));
        }
        steps.clear();
    }

    /**
     * Declared write targets, or the literal write globs of the step's agent.
     */
    private List<String> writeTargets(Step step) {
        if (!step.writes().isEmpty()) {
            return step.writes();
        }
        return registry.find(step.agent())
            .map(d -> d.permissions().allowWrite().stream().filter(GlobMatcher::isLiteral).toList())
            .orElse(List.of());
    }

    private PriorityTier priorityOf(Step step) {
        return registry.find(step.agent()).map(AgentDescriptor::priority).orElse(PriorityTier.LOW);
    }

    private void transition(WorkflowRun run, WorkflowState next) {
        run.transitionTo(next);
        audit.append(AuditEntry.of(run.runId(), AuditActions.COORDINATOR, AuditActions.WORKFLOW_STATE,
            next.name().toLowerCase(Locale.ROOT), run.workflow().name()));
    }
}
