package dev.agentos.agent;

import java.util.Map;

/**
 * Everything one invocation of an agent receives.
 */
public record AgentTask(
    String agentName,
    String action,
    Map<String, Object> inputs,
    AgentWorkspace workspace
) {
    public String input(String key) {
        Object value = inputs.get(key);
        return value == null ? null : value.toString();
    }

    public String requireInput(String key) {
        String value = input(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(
                "Action '%s' of agent '%s' requires input '%s'".formatted(action, agentName, key));
        }
        return value;
    }
}
