package dev.agentos.agent;

import dev.agentos.error.ResourceConflictException;

/**
 * Grants the exclusive right to write a project-relative path.
 */
@FunctionalInterface
public interface WriteGuard {

    WriteGuard NONE = path -> {};

    /**
     * @throws ResourceConflictException if another writer holds the path
     */
    void acquire(String path);
}
