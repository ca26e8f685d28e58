package dev.agentos.model;

import java.time.Duration;
import java.util.List;

/**
 * A registered agent: identity, capabilities and the permissions its sessions carry.
 */
public record AgentDescriptor(
    String name,
    String kind,           // built-in implementation selector, defaults to name
    String description,
    List<String> capabilities,
    PriorityTier priority,
    PermissionManifest permissions,
    Duration timeout,      // nullable, engine default applies
    int maxOperations      // per session, 0 = unlimited
) {
    public static final int DEFAULT_MAX_OPERATIONS = 50;

    public AgentDescriptor {
        capabilities = capabilities == null ? null : List.copyOf(capabilities);
        if (priority == null) {
            priority = PriorityTier.NORMAL;
        }
        if (kind == null || kind.isBlank()) {
            kind = name;
        }
    }

    /**
     * Descriptor with default kind, no description, engine timeout and default operation limit.
     */
    public static AgentDescriptor of(String name, List<String> capabilities,
                                     PriorityTier priority, PermissionManifest permissions) {
        return new AgentDescriptor(name, null, null, capabilities, priority, permissions,
            null, DEFAULT_MAX_OPERATIONS);
    }

    public AgentDescriptor withTimeout(Duration newTimeout) {
        return new AgentDescriptor(name, kind, description, capabilities, priority, permissions,
            newTimeout, maxOperations);
    }

    public AgentDescriptor withKind(String newKind) {
        return new AgentDescriptor(name, newKind, description, capabilities, priority, permissions,
            timeout, maxOperations);
    }

    public boolean hasCapability(String tag) {
        return capabilities != null && capabilities.contains(tag);
    }
}
