package dev.agentos.agent;

/**
 * The domain logic behind a registered agent.
 * Implementations reach files only through {@link AgentTask#workspace()}.
 */
@FunctionalInterface
public interface Agent {

    /**
     * Perform {@code task.action()} and return the payload to publish, or null for none.
     */
    Object perform(AgentTask task) throws Exception;
}
