package dev.agentos.error;

import dev.agentos.model.ErrorKind;

import java.util.List;

/**
 * Malformed manifest or workflow definition. Prevents a run from starting.
 */
public class ConfigException extends CoordinationException {

    private final List<String> problems;

    public ConfigException(String message) {
        this(List.of(message));
    }

    public ConfigException(List<String> problems) {
        super(ErrorKind.CONFIG, String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorKind.CONFIG, message, cause);
        this.problems = List.of(message);
    }

    public List<String> problems() {
        return problems;
    }
}
