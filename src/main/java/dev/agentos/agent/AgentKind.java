package dev.agentos.agent;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The closed set of built-in agent implementations a manifest can select with {@code kind}.
 */
public enum AgentKind {
    ECHO("echo", EchoAgent::new),
    FILE_SCAN("file-scan", FileScanAgent::new),
    FILE_WRITE("file-write", FileWriteAgent::new);

    private final String id;
    private final Supplier<Agent> factory;

    AgentKind(String id, Supplier<Agent> factory) {
        this.id = id;
        this.factory = factory;
    }

    public String id() {
        return id;
    }

    public Agent create() {
        return factory.get();
    }

    public static Optional<AgentKind> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (AgentKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
