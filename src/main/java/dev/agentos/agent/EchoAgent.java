package dev.agentos.agent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns its action and inputs unchanged. Useful for wiring and dry runs.
 */
final class EchoAgent implements Agent {

    @Override
    public Object perform(AgentTask task) {
        Map<String, Object> payload = new LinkedHashMap<>(task.inputs());
        payload.put("action", task.action());
        return payload;
    }
}
