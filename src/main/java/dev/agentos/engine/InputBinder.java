package dev.agentos.engine;

import dev.agentos.coordination.Payloads;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{key}}} placeholders in step inputs against a {@link ContextView}.
 * A value that is exactly one placeholder is replaced by a private, mutable copy of
 * the context value; placeholders embedded in text are replaced by their string form.
 */
public final class InputBinder {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*}}");

    private InputBinder() {}

    public static Map<String, Object> bind(Map<String, Object> inputs, ContextView view) {
        var bound = new LinkedHashMap<String, Object>();
        for (var entry : inputs.entrySet()) {
            bound.put(entry.getKey(), bindValue(entry.getValue(), view));
        }
        return bound;
    }

    /**
     * Root keys (the part before the first dot) of every placeholder in {@code inputs}.
     */
    public static Set<String> referencedKeys(Map<String, Object> inputs) {
        var keys = new LinkedHashSet<String>();
        collect(inputs, keys);
        return keys;
    }

    private static Object bindValue(Object value, ContextView view) {
        if (value instanceof String text) {
            Matcher whole = PLACEHOLDER.matcher(text.trim());
            if (whole.matches()) {
                return view.resolve(whole.group(1)).map(Payloads::copyOf).orElse(null);
            }
            Matcher m = PLACEHOLDER.matcher(text);
            var sb = new StringBuilder();
            while (m.find()) {
                Optional<Object> resolved = view.resolve(m.group(1));
                m.appendReplacement(sb, Matcher.quoteReplacement(resolved.map(String::valueOf).orElse("")));
            }
            m.appendTail(sb);
            return sb.toString();
        }
        if (value instanceof Map<?, ?> map) {
            var bound = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> bound.put(String.valueOf(k), bindValue(v, view)));
            return bound;
        }
        if (value instanceof List<?> list) {
            var bound = new ArrayList<Object>();
            list.forEach(v -> bound.add(bindValue(v, view)));
            return bound;
        }
        return value;
    }

    private static void collect(Object value, Set<String> keys) {
        if (value instanceof String text) {
            Matcher m = PLACEHOLDER.matcher(text);
            while (m.find()) {
                keys.add(m.group(1).split("\\.")[0]);
            }
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(v -> collect(v, keys));
        } else if (value instanceof List<?> list) {
            list.forEach(v -> collect(v, keys));
        }
    }
}
