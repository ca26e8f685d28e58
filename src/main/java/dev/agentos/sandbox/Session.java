package dev.agentos.sandbox;

import dev.agentos.model.AgentDescriptor;
import dev.agentos.model.PermissionManifest;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A capability grant tying one agent to one invocation.
 * The permission set is captured at open time and never changes.
 */
public final class Session {

    private final String token;
    private final String runId;    // nullable
    private final AgentDescriptor descriptor;
    private final PermissionManifest permissions;
    private final Instant openedAt;
    private final AtomicBoolean active = new AtomicBoolean(true);
    private final AtomicInteger operations = new AtomicInteger();

    Session(String token, String runId, AgentDescriptor descriptor) {
        this.token = token;
        this.runId = runId;
        this.descriptor = descriptor;
        this.permissions = descriptor.permissions();
        this.openedAt = Instant.now();
    }

    public String token() { return token; }
    public String runId() { return runId; }
    public String agentName() { return descriptor.name(); }
    public AgentDescriptor descriptor() { return descriptor; }
    public PermissionManifest permissions() { return permissions; }
    public Instant openedAt() { return openedAt; }
    public boolean isActive() { return active.get(); }
    public int operationCount() { return operations.get(); }

    int recordOperation() {
        return operations.incrementAndGet();
    }

    /** Returns true if this call closed the session. */
    boolean revoke() {
        return active.compareAndSet(true, false);
    }

    @Override
    public String toString() {
        return "Session[" + descriptor.name() + ":" + token + "]";
    }
}
