package dev.agentos.error;

import dev.agentos.model.ErrorKind;

public class AgentNotFoundException extends CoordinationException {

    private final String agentName;

    public AgentNotFoundException(String agentName) {
        super(ErrorKind.NOT_FOUND, "Agent not registered: " + agentName);
        this.agentName = agentName;
    }

    public String agentName() {
        return agentName;
    }
}
