package dev.agentos.agent;

import dev.agentos.error.ConfigException;
import dev.agentos.model.AgentDescriptor;
import dev.agentos.registry.AgentRegistry;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binds agent names to implementations.
 */
public final class AgentCatalog {

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();

    public AgentCatalog bind(String agentName, Agent agent) {
        agents.put(agentName, agent);
        return this;
    }

    public Optional<Agent> find(String agentName) {
        return Optional.ofNullable(agents.get(agentName));
    }

    public boolean isBound(String agentName) {
        return agents.containsKey(agentName);
    }

    /**
     * Bind every registered agent whose {@code kind} names a built-in.
     * Agents with other kinds are left for the caller to bind.
     */
    public static AgentCatalog fromRegistry(AgentRegistry registry) {
        var catalog = new AgentCatalog();
        for (AgentDescriptor descriptor : registry.list()) {
            AgentKind.fromId(descriptor.kind())
                .ifPresent(kind -> catalog.bind(descriptor.name(), kind.create()));
        }
        return catalog;
    }

    /**
     * Fail if any registered agent has no implementation.
     *
     * @throws ConfigException listing every unbound agent
     */
    public void validateAgainst(AgentRegistry registry) {
        var problems = new ArrayList<String>();
        for (AgentDescriptor descriptor : registry.list()) {
            if (!isBound(descriptor.name())) {
                problems.add("Agent '%s' has unknown kind '%s'".formatted(descriptor.name(), descriptor.kind()));
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigException(problems);
        }
    }
}
