package dev.agentos.coordination;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Workflow-scoped key/value store shared across steps. Only the
 * {@link CoordinationHub} writes to it; readers work on snapshots.
 */
public final class ExecutionContext {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private boolean destroyed;

    public synchronized Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public synchronized boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * Immutable copy of the current contents.
     */
    public synchronized Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    synchronized void put(String key, Object value) {
        if (destroyed) {
            throw new IllegalStateException("Execution context already destroyed");
        }
        values.put(key, value);
    }

    synchronized void destroy() {
        values.clear();
        destroyed = true;
    }

    public synchronized boolean isDestroyed() {
        return destroyed;
    }
}
