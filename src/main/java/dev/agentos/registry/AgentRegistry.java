package dev.agentos.registry;

import dev.agentos.error.AgentNotFoundException;
import dev.agentos.error.ConfigException;
import dev.agentos.model.AgentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds validated agent descriptors for the lifetime of the coordinator.
 * Registration order is preserved and used as the tie-breaker in capability lookups.
 */
public final class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, AgentDescriptor> agents = new LinkedHashMap<>();

    /**
     * Register a new agent.
     *
     * @throws ConfigException if required fields are missing or the name is already registered
     */
    public synchronized void register(AgentDescriptor descriptor) {
        validate(descriptor);
        if (agents.containsKey(descriptor.name())) {
            throw new ConfigException("Agent '%s' is already registered".formatted(descriptor.name()));
        }
        agents.put(descriptor.name(), descriptor);
        log.info("Registered agent [{}] priority={} capabilities={}",
            descriptor.name(), descriptor.priority().label(), descriptor.capabilities());
    }

    /**
     * Replace an existing agent, keeping its registration order.
     *
     * @throws AgentNotFoundException if no agent with that name exists
     */
    public synchronized void replace(AgentDescriptor descriptor) {
        validate(descriptor);
        if (!agents.containsKey(descriptor.name())) {
            throw new AgentNotFoundException(descriptor.name());
        }
        agents.put(descriptor.name(), descriptor);
        log.info("Replaced agent [{}]", descriptor.name());
    }

    public synchronized void registerAll(List<AgentDescriptor> descriptors) {
        for (AgentDescriptor descriptor : descriptors) {
            register(descriptor);
        }
    }

    public synchronized AgentDescriptor lookup(String name) {
        AgentDescriptor descriptor = agents.get(name);
        if (descriptor == null) {
            throw new AgentNotFoundException(name);
        }
        return descriptor;
    }

    public synchronized Optional<AgentDescriptor> find(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public synchronized boolean contains(String name) {
        return agents.containsKey(name);
    }

    /**
     * All agents declaring {@code tag}, high priority first, then registration order.
     */
    public synchronized List<AgentDescriptor> findByCapability(String tag) {
        var matches = new ArrayList<AgentDescriptor>();
        for (AgentDescriptor descriptor : agents.values()) {
            if (descriptor.hasCapability(tag)) {
                matches.add(descriptor);
            }
        }
        // List.sort is stable, so registration order survives within a tier
        matches.sort(Comparator.comparingInt(d -> d.priority().rank()));
        return matches;
    }

    public synchronized List<AgentDescriptor> list() {
        return List.copyOf(agents.values());
    }

    public synchronized int size() {
        return agents.size();
    }

    private static void validate(AgentDescriptor descriptor) {
        var problems = new ArrayList<String>();
        if (descriptor.name() == null || descriptor.name().isBlank()) {
            problems.add("Agent manifest has missing or empty name");
        }
        String label = descriptor.name() == null ? "<unnamed>" : descriptor.name();
        if (descriptor.capabilities() == null) {
            problems.add("Agent '%s' has missing capabilities".formatted(label));
        }
        if (descriptor.permissions() == null) {
            problems.add("Agent '%s' has missing permissions".formatted(label));
        }
        if (descriptor.timeout() != null && (descriptor.timeout().isZero() || descriptor.timeout().isNegative())) {
            problems.add("Agent '%s' has non-positive timeout".formatted(label));
        }
        if (descriptor.maxOperations() < 0) {
            problems.add("Agent '%s' has negative max_operations".formatted(label));
        }
        if (!problems.isEmpty()) {
            throw new ConfigException(problems);
        }
    }
}
