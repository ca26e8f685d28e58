package dev.agentos.sandbox;

import dev.agentos.audit.AuditActions;
import dev.agentos.audit.AuditLog;
import dev.agentos.error.PermissionViolationException;
import dev.agentos.error.SessionExpiredException;
import dev.agentos.model.AgentDescriptor;
import dev.agentos.model.AuditEntry;
import dev.agentos.model.PermissionManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues sessions and decides every file-system access an agent makes.
 * Fails closed: a path no allow glob matches is denied.
 */
public final class PermissionSandbox {

    private static final Logger log = LoggerFactory.getLogger(PermissionSandbox.class);

    static final String OUTSIDE_ROOT = "path_traversal_attempt";
    static final String DENIED_PATH = "restricted_path";
    static final String NOT_ALLOWED = "not_allowed";
    static final String OPERATION_LIMIT = "operation_limit_exceeded";

    private final Path projectRoot;
    private final AuditLog audit;
    private final Map<String, Session> activeSessions = new ConcurrentHashMap<>();
    private final List<Violation> violations = new ArrayList<>();

    public PermissionSandbox(Path projectRoot, AuditLog audit) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.audit = audit;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public Session openSession(AgentDescriptor descriptor) {
        return openSession(descriptor, null);
    }

    public Session openSession(AgentDescriptor descriptor, String runId) {
        var session = new Session(UUID.randomUUID().toString(), runId, descriptor);
        activeSessions.put(session.token(), session);
        audit.append(AuditEntry.of(runId, descriptor.name(), AuditActions.SESSION_OPEN, "ok", session.token()));
        log.debug("Opened {}", session);
        return session;
    }

    /**
     * Decide whether {@code session} may perform {@code operation} on {@code path}.
     *
     * @return the path normalised relative to the project root, with {@code /} separators
     * @throws SessionExpiredException if the session was closed or revoked
     * @throws PermissionViolationException if the access is denied; the session is revoked
     */
    public String check(Session session, Operation operation, String path) {
        if (!session.isActive()) {
            audit.append(AuditEntry.permission(session.runId(), session.agentName(), AuditEntry.Decision.DENY,
                "%s %s: session expired".formatted(operation, path)));
            throw new SessionExpiredException(session.token());
        }

        int maxOperations = session.descriptor().maxOperations();
        if (maxOperations > 0 && session.recordOperation() > maxOperations) {
            throw deny(session, operation, path, OPERATION_LIMIT,
                "Exceeded max operations limit: " + maxOperations);
        }

        Path absolute = projectRoot.resolve(path).normalize();
        if (!absolute.startsWith(projectRoot)) {
            throw deny(session, operation, path, OUTSIDE_ROOT, "Path escapes the project root");
        }
        if (!resolvesInsideRoot(absolute)) {
            throw deny(session, operation, path, OUTSIDE_ROOT, "Path resolves outside the project root through a link");
        }
        String relative = toRelative(absolute);

        PermissionManifest permissions = session.permissions();
        if (GlobMatcher.matchesAny(permissions.deny(), relative)) {
            throw deny(session, operation, relative, DENIED_PATH, "Path matches a deny rule");
        }
        if (!GlobMatcher.matchesAny(operation.allowGlobs(permissions), relative)) {
            throw deny(session, operation, relative, NOT_ALLOWED,
                "No %s rule allows this path".formatted(operation.name().toLowerCase(Locale.ROOT)));
        }

        audit.append(AuditEntry.permission(session.runId(), session.agentName(), AuditEntry.Decision.ALLOW,
            operation + " " + relative));
        return relative;
    }

    /**
     * Close a session. Closing twice is harmless.
     */
    public void closeSession(Session session) {
        activeSessions.remove(session.token());
        if (session.revoke()) {
            audit.append(AuditEntry.of(session.runId(), session.agentName(), AuditActions.SESSION_CLOSE, "ok",
                "%s operations=%d".formatted(session.token(), session.operationCount())));
            log.debug("Closed {}", session);
        }
    }

    public int activeSessionCount() {
        return activeSessions.size();
    }

    public synchronized List<Violation> violations() {
        return List.copyOf(violations);
    }

    private PermissionViolationException deny(Session session, Operation operation, String path,
                                              String type, String details) {
        synchronized (this) {
            violations.add(new Violation(Instant.now(), session.agentName(), type, operation, path, details));
        }
        audit.append(AuditEntry.permission(session.runId(), session.agentName(), AuditEntry.Decision.DENY,
            "%s %s: %s".formatted(operation, path, details)));
        log.warn("Permission denied for agent [{}]: {} {} ({})", session.agentName(), operation, path, details);
        activeSessions.remove(session.token());
        if (session.revoke()) {
            audit.append(AuditEntry.of(session.runId(), session.agentName(), AuditActions.SESSION_CLOSE,
                "revoked", session.token()));
        }
        return new PermissionViolationException(session.agentName(), path,
            "Agent '%s' denied %s on '%s': %s".formatted(session.agentName(), operation, path, details));
    }

    /**
     * Follows links on the deepest existing part of {@code absolute}, so a write to a
     * new file is judged by the real location of its parent directory. A path whose
     * real location cannot be determined is treated as outside.
     */
    private boolean resolvesInsideRoot(Path absolute) {
        Path existing = absolute;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return false;
        }
        try {
            return existing.toRealPath().startsWith(projectRoot.toRealPath());
        } catch (IOException e) {
            log.debug("Cannot resolve real path of {}: {}", absolute, e.toString());
            return false;
        }
    }

    private String toRelative(Path absolute) {
        String relative = projectRoot.relativize(absolute).toString();
        return relative.replace('\\', '/');
    }
}
