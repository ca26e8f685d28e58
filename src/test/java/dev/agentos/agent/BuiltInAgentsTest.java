package dev.agentos.agent;

import dev.agentos.audit.AuditLog;
import dev.agentos.model.AgentDescriptor;
import dev.agentos.model.AgentResult;
import dev.agentos.model.ErrorKind;
import dev.agentos.model.PermissionManifest;
import dev.agentos.model.PriorityTier;
import dev.agentos.registry.AgentRegistry;
import dev.agentos.sandbox.PermissionSandbox;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BuiltInAgentsTest {

    @TempDir
    Path root;

    private final AgentRegistry registry = new AgentRegistry();
    private PermissionSandbox sandbox;
    private ExecutionUnit unit;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("src/util"));
        Files.writeString(root.resolve("src/App.java"), "class App {\n}\n");
        Files.writeString(root.resolve("src/util/Strings.java"), "class Strings {\n  // helpers\n}\n");
        Files.writeString(root.resolve("src/util/secret.key"), "k\n");

        PermissionManifest scanPermissions = new PermissionManifest(List.of("src/**"), List.of(), List.of(),
            List.of("**/*.key"));
        registry.register(AgentDescriptor.of("scanner", List.of("analysis"), PriorityTier.HIGH, scanPermissions)
            .withKind("file-scan"));
        registry.register(AgentDescriptor.of("scribe", List.of("docs"), PriorityTier.NORMAL,
            PermissionManifest.readWrite(List.of(), List.of("docs/**"))).withKind("file-write"));
        registry.register(AgentDescriptor.of("echo-agent", List.of("debug"), PriorityTier.LOW,
            PermissionManifest.empty()).withKind("ECHO"));

        AgentCatalog catalog = AgentCatalog.fromRegistry(registry);
        catalog.validateAgainst(registry);
        sandbox = new PermissionSandbox(root, AuditLog.inMemory());
        unit = new ExecutionUnit(catalog, sandbox, AuditLog.inMemory(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        unit.close();
    }

    private AgentResult invoke(String agent, String action, Map<String, Object> inputs) {
        AgentDescriptor descriptor = registry.lookup(agent);
        return unit.invoke(descriptor, action, inputs, sandbox.openSession(descriptor));
    }

    @Test
    void fileScanCountsReadableFilesOnly() {
        AgentResult result = invoke("scanner", "analyze", Map.of("target", "src/**"));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.payload()).asInstanceOf(InstanceOfAssertFactories.MAP)
            .containsEntry("files", 2)
            .containsEntry("lines", 5)
            .containsEntry("per_file", Map.of("src/App.java", 2, "src/util/Strings.java", 3));
    }

    @Test
    void fileScanRequiresTarget() {
        AgentResult result = invoke("scanner", "analyze", Map.of());

        assertThat(result.errorKind()).isEqualTo(ErrorKind.AGENT_INTERNAL_ERROR);
        assertThat(result.message()).contains("requires input 'target'");
    }

    @Test
    void fileWriteCreatesParentDirectories() throws Exception {
        AgentResult result = invoke("scribe", "update", Map.of("path", "docs/api/index.md", "content", "hello"));

        assertThat(result.payload()).isEqualTo(Map.of("path", "docs/api/index.md", "bytes", 5));
        assertThat(Files.readString(root.resolve("docs/api/index.md"))).isEqualTo("hello");
    }

    @Test
    void fileWriteOutsideItsManifestIsViolation() {
        AgentResult result = invoke("scribe", "update", Map.of("target", "src/App.java", "content", "oops"));

        assertThat(result.errorKind()).isEqualTo(ErrorKind.PERMISSION_VIOLATION);
    }

    @Test
    void echoReturnsActionAndInputs() {
        AgentResult result = invoke("echo-agent", "ping", Map.of("message", "hi"));

        assertThat(result.payload()).isEqualTo(Map.of("message", "hi", "action", "ping"));
    }
}
