package dev.agentos.model;

/**
 * A file an agent touched during one invocation.
 */
public record SideEffect(String path, Access access) {

    public enum Access {
        READ,
        WRITE,
        EXECUTE
    }

    public static SideEffect read(String path) {
        return new SideEffect(path, Access.READ);
    }

    public static SideEffect write(String path) {
        return new SideEffect(path, Access.WRITE);
    }
}
