package dev.agentos.error;

import dev.agentos.model.ErrorKind;

/**
 * Base class of every error raised by the coordinator. Each carries its {@link ErrorKind}.
 */
public class CoordinationException extends RuntimeException {

    private final ErrorKind kind;

    public CoordinationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CoordinationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
