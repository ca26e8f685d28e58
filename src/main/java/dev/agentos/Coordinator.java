package dev.agentos;

import dev.agentos.agent.Agent;
import dev.agentos.agent.AgentCatalog;
import dev.agentos.agent.ExecutionUnit;
import dev.agentos.audit.AuditLog;
import dev.agentos.config.EngineSettings;
import dev.agentos.engine.ExecutionPlan;
import dev.agentos.engine.WorkflowCatalog;
import dev.agentos.engine.WorkflowEngine;
import dev.agentos.engine.WorkflowLoader;
import dev.agentos.engine.WorkflowPlanner;
import dev.agentos.engine.WorkflowRun;
import dev.agentos.engine.WorkflowValidator;
import dev.agentos.error.ConfigException;
import dev.agentos.model.AgentDescriptor;
import dev.agentos.model.AgentResult;
import dev.agentos.model.AuditEntry;
import dev.agentos.model.RetryPolicy;
import dev.agentos.model.Step;
import dev.agentos.model.WorkflowDefinition;
import dev.agentos.model.WorkflowResult;
import dev.agentos.registry.AgentRegistry;
import dev.agentos.registry.AgentStatus;
import dev.agentos.registry.ManifestLoader;
import dev.agentos.sandbox.PermissionSandbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Wires registry, sandbox, execution unit and engine together and exposes the
 * operations the command line relies on.
 */
public final class Coordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final EngineSettings settings;
    private final AgentRegistry registry;
    private final AgentCatalog catalog;
    private final WorkflowCatalog workflows;
    private final AuditLog audit;
    private final PermissionSandbox sandbox;
    private final ExecutionUnit executionUnit;
    private final WorkflowEngine engine;

    public Coordinator(EngineSettings settings, AgentRegistry registry, AgentCatalog catalog,
                       WorkflowCatalog workflows, AuditLog audit) {
        this.settings = settings;
        this.registry = registry;
        this.catalog = catalog;
        this.workflows = workflows;
        this.audit = audit;
        this.sandbox = new PermissionSandbox(settings.resolvedRoot(), audit);
        this.executionUnit = new ExecutionUnit(catalog, sandbox, audit, settings.defaultTimeout());
        this.engine = new WorkflowEngine(registry, sandbox, executionUnit, audit, settings.maxConcurrent());
    }

    /**
     * Load agent manifests and workflows from the configured directories, bind built-in
     * implementations and check that every agent has one.
     *
     * @throws ConfigException if a manifest or workflow is invalid, or an agent has no implementation
     */
    public static Coordinator load(EngineSettings settings) throws IOException {
        var registry = new AgentRegistry();
        registry.registerAll(ManifestLoader.loadFromDirectory(settings.resolvedAgentsDir()));

        var catalog = AgentCatalog.fromRegistry(registry);
        catalog.validateAgainst(registry);

        var workflows = new WorkflowCatalog();
        for (WorkflowDefinition workflow : WorkflowLoader.loadFromDirectory(settings.resolvedWorkflowsDir())) {
            workflows.register(workflow);
        }

        Path auditFile = settings.resolvedAuditLog();
        AuditLog audit = auditFile == null ? AuditLog.inMemory() : AuditLog.appendingTo(auditFile);
        log.info("Loaded {} agents and {} workflows from {}", registry.size(), workflows.names().size(),
            settings.resolvedRoot());
        return new Coordinator(settings, registry, catalog, workflows, audit);
    }

    public Coordinator bind(String agentName, Agent agent) {
        catalog.bind(agentName, agent);
        return this;
    }

    public List<AgentDescriptor> listAgents() {
        return registry.list();
    }

    public List<String> listWorkflows() {
        return workflows.names();
    }

    /**
     * Run one agent action as a single-step workflow.
     */
    public AgentResult runAgent(String agentName, String action, String target) {
        registry.lookup(agentName);
        var step = new Step(agentName, agentName, action, Map.of("target", target), List.of(), null, "result",
            true, RetryPolicy.none(), List.of());
        WorkflowResult result = engine.execute(WorkflowDefinition.of("run-agent:" + agentName, List.of(step)));
        return result.steps().get(0).result();
    }

    public WorkflowResult runWorkflow(String name) {
        return runWorkflow(name, Map.of());
    }

    public WorkflowResult runWorkflow(String name, Map<String, Object> parameters) {
        return engine.execute(startRun(name, parameters));
    }

    /**
     * Create a run without executing it, so the caller can cancel it from another thread.
     */
    public WorkflowRun startRun(String name, Map<String, Object> parameters) {
        return engine.newRun(workflow(name), parameters);
    }

    public WorkflowResult execute(WorkflowRun run) {
        return engine.execute(run);
    }

    /**
     * Validate a workflow and return its static plan without running anything.
     */
    public ExecutionPlan plan(String name) {
        WorkflowDefinition workflow = workflow(name);
        WorkflowValidator.requireValid(workflow);
        return WorkflowPlanner.plan(workflow);
    }

    /**
     * Last-known health of an agent, from this process's audit trail or, if empty, the audit file.
     */
    public AgentStatus agentStatus(String agentName) throws IOException {
        registry.lookup(agentName);
        List<AuditEntry> entries = audit.entries();
        Path auditFile = settings.resolvedAuditLog();
        if (entries.isEmpty() && auditFile != null) {
            entries = AuditLog.readEntries(auditFile);
        }
        return AgentStatus.fromAudit(agentName, catalog.isBound(agentName), entries);
    }

    public AgentRegistry registry() {
        return registry;
    }

    public WorkflowCatalog workflows() {
        return workflows;
    }

    public AuditLog audit() {
        return audit;
    }

    public PermissionSandbox sandbox() {
        return sandbox;
    }

    private WorkflowDefinition workflow(String name) {
        return workflows.get(name)
            .orElseThrow(() -> new ConfigException("Workflow not found: " + name));
    }

    @Override
    public void close() {
        executionUnit.close();
    }
}
