package dev.agentos.error;

import dev.agentos.model.ErrorKind;

/**
 * A write target is already leased by another step of the same wave.
 */
public class ResourceConflictException extends CoordinationException {

    private final String path;
    private final String holder;

    public ResourceConflictException(String path, String holder) {
        super(ErrorKind.RESOURCE_CONFLICT, "Write to '%s' denied: held by step '%s'".formatted(path, holder));
        this.path = path;
        this.holder = holder;
    }

    public String path() {
        return path;
    }

    public String holder() {
        return holder;
    }
}
