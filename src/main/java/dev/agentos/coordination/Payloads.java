package dev.agentos.coordination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions that keep context values private to the hub. Published payloads are
 * frozen into immutable JSON-shaped trees of maps, lists and scalars; readers get
 * mutable copies of them.
 */
public final class Payloads {

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private Payloads() {}

    /**
     * Deep, immutable copy of {@code payload}.
     *
     * @throws IllegalArgumentException if the payload cannot be represented as JSON
     */
    public static Object freeze(Object payload) {
        if (payload == null) {
            return null;
        }
        JsonNode tree = MAPPER.valueToTree(payload);
        try {
            return unmodifiable(MAPPER.treeToValue(tree, Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not JSON-compatible: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Deep, mutable copy of a map/list tree. Other values are returned as they are.
     */
    public static Object copyOf(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copyOf(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            list.forEach(v -> copy.add(copyOf(v)));
            return copy;
        }
        return value;
    }

    private static Object unmodifiable(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), unmodifiable(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            list.forEach(v -> copy.add(unmodifiable(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
