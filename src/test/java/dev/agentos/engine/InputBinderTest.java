package dev.agentos.engine;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InputBinderTest {

    private final ContextView view = ContextView.of(Map.of(
        "analysis", Map.of("files", 12, "issues", List.of("a", "b")),
        "target", "src/**"));

    @Test
    void wholePlaceholderBindsRawValue() {
        Map<String, Object> bound = InputBinder.bind(Map.of("issues", "{{ analysis.issues }}"), view);

        assertThat(bound.get("issues")).isEqualTo(List.of("a", "b"));
    }

    @Test
    void embeddedPlaceholdersAreSubstituted() {
        Map<String, Object> bound = InputBinder.bind(
            Map.of("summary", "Scanned {{analysis.files}} files under {{target}}{{unknown}}"), view);

        assertThat(bound).containsEntry("summary", "Scanned 12 files under src/**");
    }

    @Test
    void bindsNestedStructuresAndKeepsOtherValues() {
        Map<String, Object> inputs = Map.of(
            "options", Map.of("glob", "{{target}}", "depth", 2),
            "paths", List.of("{{target}}", "docs/**"));

        Map<String, Object> bound = InputBinder.bind(inputs, view);

        assertThat(bound.get("options")).isEqualTo(Map.of("glob", "src/**", "depth", 2));
        assertThat(bound.get("paths")).isEqualTo(List.of("src/**", "docs/**"));
    }

    @Test
    void missingWholePlaceholderBindsNull() {
        assertThat(InputBinder.bind(Map.of("x", "{{nothing}}"), view)).containsEntry("x", null);
    }

    @Test
    void referencedKeysAreRootSegments() {
        Map<String, Object> inputs = Map.of(
            "a", "{{analysis.files}} and {{ target }}",
            "b", List.of(Map.of("c", "{{review-notes}}")),
            "d", 3);

        assertThat(InputBinder.referencedKeys(inputs)).containsExactlyInAnyOrder("analysis", "target", "review-notes");
    }
}
