package dev.agentos.agent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inventories readable files matching the {@code target} glob: file count,
 * line count and per-file line totals.
 */
final class FileScanAgent implements Agent {

    @Override
    public Object perform(AgentTask task) throws Exception {
        String target = task.requireInput("target");
        List<String> files = task.workspace().list(target);

        Map<String, Integer> perFile = new LinkedHashMap<>();
        int lines = 0;
        for (String file : files) {
            int count = (int) task.workspace().read(file).lines().count();
            perFile.put(file, count);
            lines += count;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("target", target);
        payload.put("files", files.size());
        payload.put("lines", lines);
        payload.put("per_file", perFile);
        return payload;
    }
}
