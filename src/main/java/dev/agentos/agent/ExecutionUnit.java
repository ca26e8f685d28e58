package dev.agentos.agent;

import dev.agentos.audit.AuditActions;
import dev.agentos.audit.AuditLog;
import dev.agentos.error.CoordinationException;
import dev.agentos.model.AgentDescriptor;
import dev.agentos.model.AgentResult;
import dev.agentos.model.AuditEntry;
import dev.agentos.model.ErrorKind;
import dev.agentos.sandbox.PermissionSandbox;
import dev.agentos.sandbox.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs exactly one agent action inside one session and turns whatever happens into
 * exactly one {@link AgentResult}. Agent failures never escape as exceptions.
 */
public final class ExecutionUnit implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionUnit.class);

    private final AgentCatalog catalog;
    private final PermissionSandbox sandbox;
    private final AuditLog audit;
    private final Duration defaultTimeout;
    private final ExecutorService workers;

    public ExecutionUnit(AgentCatalog catalog, PermissionSandbox sandbox, AuditLog audit, Duration defaultTimeout) {
        this.catalog = catalog;
        this.sandbox = sandbox;
        this.audit = audit;
        this.defaultTimeout = defaultTimeout;
        this.workers = Executors.newCachedThreadPool(daemonThreads("agent-worker"));
    }

    public AgentResult invoke(AgentDescriptor descriptor, String action, Map<String, Object> inputs, Session session) {
        return invoke(descriptor, action, inputs, session, WriteGuard.NONE);
    }

    /**
     * Invoke {@code action} of {@code descriptor}'s agent. The session is closed before returning.
     */
    public AgentResult invoke(AgentDescriptor descriptor, String action, Map<String, Object> inputs,
                              Session session, WriteGuard writeGuard) {
        long start = System.nanoTime();
        AgentResult result;
        try {
            result = execute(descriptor, action, inputs, session, writeGuard, start);
        } finally {
            sandbox.closeSession(session);
        }
        audit.append(AuditEntry.of(session.runId(), descriptor.name(), AuditActions.AGENT_INVOKE,
            result.status().name().toLowerCase(Locale.ROOT), describe(action, result)));
        return result;
    }

    private AgentResult execute(AgentDescriptor descriptor, String action, Map<String, Object> inputs,
                                Session session, WriteGuard writeGuard, long start) {
        Optional<Agent> agent = catalog.find(descriptor.name());
        if (agent.isEmpty()) {
            return AgentResult.failure(ErrorKind.NOT_FOUND,
                "No implementation bound for agent '%s'".formatted(descriptor.name()));
        }

        var workspace = new AgentWorkspace(sandbox, session, writeGuard);
        var task = new AgentTask(descriptor.name(), action, Collections.unmodifiableMap(new LinkedHashMap<>(inputs)), workspace);
        Duration timeout = descriptor.timeout() != null ? descriptor.timeout() : defaultTimeout;

        log.debug("Invoking agent [{}] action [{}] timeout={}", descriptor.name(), action, timeout);
        Future<Object> future = workers.submit(() -> agent.get().perform(task));
        try {
            Object payload = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            RuntimeException violation = workspace.violation();
            if (violation != null) {
                return failure(violation, start, workspace);
            }
            return AgentResult.success(payload, elapsed(start), workspace.sideEffects());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Agent [{}] action [{}] timed out after {}", descriptor.name(), action, timeout);
            return AgentResult.failure(ErrorKind.TIMEOUT,
                "Timed out after %d ms".formatted(timeout.toMillis()), elapsed(start), workspace.sideEffects());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            RuntimeException violation = workspace.violation();
            if (violation != null) {
                return failure(violation, start, workspace);
            }
            return failure(cause, start, workspace);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return AgentResult.failure(ErrorKind.AGENT_INTERNAL_ERROR, "Interrupted while waiting for agent",
                elapsed(start), workspace.sideEffects());
        }
    }

    private AgentResult failure(Throwable cause, long start, AgentWorkspace workspace) {
        if (cause instanceof CoordinationException coordination) {
            return AgentResult.failure(coordination.kind(), coordination.getMessage(), elapsed(start),
                workspace.sideEffects());
        }
        log.warn("Agent raised {}", cause.toString(), cause);
        return AgentResult.failure(ErrorKind.AGENT_INTERNAL_ERROR,
            cause.getClass().getSimpleName() + ": " + cause.getMessage(), elapsed(start), workspace.sideEffects());
    }

    private static String describe(String action, AgentResult result) {
        if (result.succeeded()) {
            return "%s in %d ms".formatted(action, result.duration().toMillis());
        }
        return "%s %s: %s".formatted(action, result.errorKind(), result.message());
    }

    private static Duration elapsed(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    public static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
