package dev.agentos.agent;

import dev.agentos.model.SideEffect;
import dev.agentos.sandbox.GlobMatcher;
import dev.agentos.sandbox.Operation;
import dev.agentos.sandbox.PermissionSandbox;
import dev.agentos.sandbox.Session;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * File-system view handed to an agent. Every access is checked by the sandbox
 * against the invocation's session and recorded as a side effect.
 */
public final class AgentWorkspace {

    private final PermissionSandbox sandbox;
    private final Session session;
    private final WriteGuard writeGuard;
    private final List<SideEffect> sideEffects = new ArrayList<>();
    private RuntimeException violation;

    AgentWorkspace(PermissionSandbox sandbox, Session session, WriteGuard writeGuard) {
        this.sandbox = sandbox;
        this.session = session;
        this.writeGuard = writeGuard;
    }

    public String read(String path) throws IOException {
        String relative = check(Operation.READ, path);
        String content = Files.readString(resolve(relative), StandardCharsets.UTF_8);
        record(SideEffect.read(relative));
        return content;
    }

    public boolean exists(String path) {
        String relative = check(Operation.READ, path);
        return Files.exists(resolve(relative));
    }

    public void write(String path, String content) throws IOException {
        String relative = check(Operation.WRITE, path);
        try {
            writeGuard.acquire(relative);
        } catch (RuntimeException e) {
            remember(e);
            throw e;
        }
        Path target = resolve(relative);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        record(SideEffect.write(relative));
    }

    /**
     * Check that {@code path} may be executed; running it is up to the agent.
     */
    public Path executable(String path) {
        String relative = check(Operation.EXECUTE, path);
        record(new SideEffect(relative, SideEffect.Access.EXECUTE));
        return resolve(relative);
    }

    /**
     * Project files matching {@code glob} that this session may read, sorted.
     * Files the session may not read are left out rather than reported as violations.
     */
    public List<String> list(String glob) throws IOException {
        var matches = new ArrayList<String>();
        Path root = sandbox.projectRoot();
        try (Stream<Path> files = Files.walk(root)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                String relative = root.relativize(file).toString().replace('\\', '/');
                if (GlobMatcher.matches(glob, relative) && readable(relative)) {
                    matches.add(relative);
                }
            }
        }
        return matches;
    }

    public synchronized List<SideEffect> sideEffects() {
        return List.copyOf(sideEffects);
    }

    /**
     * The first sandbox or conflict error raised through this workspace, even if the agent caught it.
     */
    synchronized RuntimeException violation() {
        return violation;
    }

    private boolean readable(String relative) {
        var manifest = session.permissions();
        return GlobMatcher.matchesAny(manifest.allowRead(), relative)
            && !GlobMatcher.matchesAny(manifest.deny(), relative);
    }

    private String check(Operation operation, String path) {
        try {
            return sandbox.check(session, operation, path);
        } catch (RuntimeException e) {
            remember(e);
            throw e;
        }
    }

    private synchronized void remember(RuntimeException e) {
        if (violation == null) {
            violation = e;
        }
    }

    private synchronized void record(SideEffect effect) {
        sideEffects.add(effect);
    }

    private Path resolve(String relative) {
        return sandbox.projectRoot().resolve(relative);
    }
}
