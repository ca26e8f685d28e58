package dev.agentos.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the values one step may see: run parameters plus the outputs of
 * its ancestors, as published before the step's wave started.
 */
public final class ContextView {

    private final Map<String, Object> values;

    ContextView(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ContextView of(Map<String, Object> values) {
        return new ContextView(values);
    }

    public Map<String, Object> values() {
        return values;
    }

    /**
     * Resolve {@code key.nested.field}. A bare name that is not a key is looked up one
     * level inside map-valued entries, first match in publication order.
     */
    public Optional<Object> resolve(String identifier) {
        String[] segments = identifier.split("\\.");
        if (values.containsKey(segments[0])) {
            Object current = values.get(segments[0]);
            for (int i = 1; i < segments.length; i++) {
                if (!(current instanceof Map<?, ?> map) || !map.containsKey(segments[i])) {
                    return Optional.empty();
                }
                current = map.get(segments[i]);
            }
            return Optional.ofNullable(current);
        }
        if (segments.length == 1) {
            for (Object value : values.values()) {
                if (value instanceof Map<?, ?> map && map.containsKey(identifier)) {
                    return Optional.ofNullable(map.get(identifier));
                }
            }
        }
        return Optional.empty();
    }
}
