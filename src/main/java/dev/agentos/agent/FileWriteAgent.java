package dev.agentos.agent;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes {@code content} to {@code path} (or {@code target}).
 */
final class FileWriteAgent implements Agent {

    @Override
    public Object perform(AgentTask task) throws Exception {
        String path = task.input("path") != null ? task.input("path") : task.requireInput("target");
        String content = task.input("content") == null ? "" : task.input("content");
        task.workspace().write(path, content);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("path", path);
        payload.put("bytes", content.getBytes(StandardCharsets.UTF_8).length);
        return payload;
    }
}
