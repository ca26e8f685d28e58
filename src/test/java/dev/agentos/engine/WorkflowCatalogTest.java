package dev.agentos.engine;

import dev.agentos.model.Step;
import dev.agentos.model.WorkflowDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowCatalogTest {

    private static WorkflowDefinition version(String name, String version) {
        return new WorkflowDefinition(name, version, null, List.of(Step.of("s", "echo", "run", List.of())), null);
    }

    @Test
    void latestVersionComparesNumerically() {
        var catalog = new WorkflowCatalog();
        catalog.register(version("deploy", "1.9.0"));
        catalog.register(version("deploy", "1.10.0"));
        catalog.register(version("deploy", "1.2"));

        assertThat(catalog.get("deploy")).map(WorkflowDefinition::version).contains("1.10.0");
        assertThat(catalog.versions("deploy")).containsExactly("1.2", "1.9.0", "1.10.0");
    }

    @Test
    void specificVersionLookup() {
        var catalog = new WorkflowCatalog();
        catalog.register(version("deploy", "1.0.0"));
        catalog.register(version("review", "0.3.0"));

        assertThat(catalog.get("deploy", "1.0.0")).isPresent();
        assertThat(catalog.get("deploy", "2.0.0")).isEmpty();
        assertThat(catalog.get("unknown")).isEmpty();
        assertThat(catalog.names()).containsExactly("deploy", "review");
    }

    @Test
    void reRegisteringAVersionReplacesIt() {
        var catalog = new WorkflowCatalog();
        catalog.register(version("deploy", "1.0.0"));
        WorkflowDefinition updated = new WorkflowDefinition("deploy", "1.0.0", "patched",
            List.of(Step.of("s", "echo", "run", List.of())), null);
        catalog.register(updated);

        assertThat(catalog.versions("deploy")).containsExactly("1.0.0");
        assertThat(catalog.get("deploy")).contains(updated);
    }

    @Test
    void versionOrderTreatsMissingPartsAsZero() {
        assertThat(WorkflowCatalog.compareVersions("1.0", "1.0.0")).isZero();
        assertThat(WorkflowCatalog.compareVersions("2.0.0", "10.0.0")).isNegative();
        assertThat(WorkflowCatalog.compareVersions("1.0.0-beta", "1.0.0-alpha")).isPositive();
    }
}
