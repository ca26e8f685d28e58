package dev.agentos.error;

import dev.agentos.model.ErrorKind;

/**
 * Sandbox denial. Fails the offending step, never the whole run.
 */
public class PermissionViolationException extends CoordinationException {

    private final String agentName;
    private final String path;

    public PermissionViolationException(String agentName, String path, String message) {
        super(ErrorKind.PERMISSION_VIOLATION, message);
        this.agentName = agentName;
        this.path = path;
    }

    public String agentName() {
        return agentName;
    }

    public String path() {
        return path;
    }
}
