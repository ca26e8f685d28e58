package dev.agentos.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.agentos.Coordinator;
import dev.agentos.config.EngineSettings;
import dev.agentos.config.SettingsLoader;
import dev.agentos.error.CoordinationException;
import dev.agentos.model.AgentDescriptor;
import dev.agentos.model.AgentResult;
import dev.agentos.model.WorkflowResult;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the agent coordinator. Results are printed as JSON.
 */
@Command(
    name = "agent-os",
    mixinStandardHelpOptions = true,
    description = "Run sandboxed agents alone or as dependency-ordered workflows.",
    subcommands = {
        AgentOsCli.ListAgents.class,
        AgentOsCli.ListWorkflows.class,
        AgentOsCli.RunAgent.class,
        AgentOsCli.RunWorkflow.class,
        AgentOsCli.AgentStatusCommand.class
    }
)
public class AgentOsCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    private static final ObjectMapper JSON = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--project-root", defaultValue = ".", description = "Project root the sandbox confines agents to")
    Path projectRoot;

    @Option(names = "--config", description = "Settings file (default: <project-root>/agent-os.yaml)")
    Path config;

    @Option(names = "--max-concurrent", description = "Override the maximum number of steps run in parallel")
    Integer maxConcurrent;

    @Option(names = "--audit-log", description = "Override the JSON-lines audit log file")
    Path auditLog;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    EngineSettings settings() throws IOException {
        Path file = config != null ? config : projectRoot.resolve(SettingsLoader.DEFAULT_FILE);
        EngineSettings settings = SettingsLoader.load(projectRoot, file);
        if (maxConcurrent != null) {
            settings = settings.withMaxConcurrent(maxConcurrent);
        }
        if (auditLog != null) {
            settings = settings.withAuditLog(auditLog);
        }
        return settings;
    }

    Coordinator coordinator() throws IOException {
        return Coordinator.load(settings());
    }

    void print(Object value) throws JsonProcessingException {
        PrintWriter out = spec.commandLine().getOut();
        out.println(JSON.writeValueAsString(value));
        out.flush();
    }

    /**
     * Maps coordinator errors to exit codes instead of stack traces.
     */
    public static int handleExecutionException(Exception ex, CommandLine cmd, CommandLine.ParseResult parseResult)
        throws Exception {
        if (ex instanceof CoordinationException coordination) {
            cmd.getErr().println("Error [" + coordination.kind() + "]: " + coordination.getMessage());
            return EXIT_CONFIG;
        }
        throw ex;
    }

    @Command(name = "list-agents", description = "List registered agents")
    static class ListAgents implements Callable<Integer> {

        @ParentCommand
        AgentOsCli parent;

        @Override
        public Integer call() throws Exception {
            try (Coordinator coordinator = parent.coordinator()) {
                List<Map<String, Object>> agents = coordinator.listAgents().stream().map(ListAgents::summary).toList();
                parent.print(agents);
            }
            return EXIT_OK;
        }

        private static Map<String, Object> summary(AgentDescriptor descriptor) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("name", descriptor.name());
            summary.put("capabilities", descriptor.capabilities());
            summary.put("priority", descriptor.priority().label());
            return summary;
        }
    }

    @Command(name = "list-workflows", description = "List loaded workflows and their versions")
    static class ListWorkflows implements Callable<Integer> {

        @ParentCommand
        AgentOsCli parent;

        @Override
        public Integer call() throws Exception {
            try (Coordinator coordinator = parent.coordinator()) {
                Map<String, Object> workflows = new LinkedHashMap<>();
                for (String name : coordinator.listWorkflows()) {
                    workflows.put(name, coordinator.workflows().versions(name));
                }
                parent.print(workflows);
            }
            return EXIT_OK;
        }
    }

    @Command(name = "run-agent", description = "Run one agent action against a target")
    static class RunAgent implements Callable<Integer> {

        @ParentCommand
        AgentOsCli parent;

        @Parameters(index = "0", description = "Agent name")
        String name;

        @Parameters(index = "1", description = "Action")
        String action;

        @Parameters(index = "2", description = "Target passed as the 'target' input")
        String target;

        @Override
        public Integer call() throws Exception {
            try (Coordinator coordinator = parent.coordinator()) {
                AgentResult result = coordinator.runAgent(name, action, target);
                parent.print(result);
                return result.succeeded() ? EXIT_OK : EXIT_FAILED;
            }
        }
    }

    @Command(name = "run-workflow", description = "Run a workflow to completion")
    static class RunWorkflow implements Callable<Integer> {

        @ParentCommand
        AgentOsCli parent;

        @Parameters(index = "0", description = "Workflow name")
        String name;

        @Option(names = "--dry-run", description = "Print the validated wave plan without executing")
        boolean dryRun;

        @Option(names = "--param", description = "Run parameter visible to guards and inputs, key=value")
        Map<String, String> params = new LinkedHashMap<>();

        @Override
        public Integer call() throws Exception {
            try (Coordinator coordinator = parent.coordinator()) {
                if (dryRun) {
                    parent.print(coordinator.plan(name));
                    return EXIT_OK;
                }
                WorkflowResult result = coordinator.runWorkflow(name, new LinkedHashMap<>(params));
                parent.print(result);
                return result.allRequiredSucceeded() ? EXIT_OK : EXIT_FAILED;
            }
        }
    }

    @Command(name = "agent-status", description = "Show last-known health of an agent")
    static class AgentStatusCommand implements Callable<Integer> {

        @ParentCommand
        AgentOsCli parent;

        @Parameters(index = "0", description = "Agent name")
        String name;

        @Override
        public Integer call() throws Exception {
            try (Coordinator coordinator = parent.coordinator()) {
                parent.print(coordinator.agentStatus(name));
            }
            return EXIT_OK;
        }
    }
}
