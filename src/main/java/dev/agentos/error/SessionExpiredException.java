package dev.agentos.error;

import dev.agentos.model.ErrorKind;

/**
 * Use of a session after it was closed or revoked.
 */
public class SessionExpiredException extends CoordinationException {

    public SessionExpiredException(String token) {
        super(ErrorKind.PERMISSION_VIOLATION, "Session expired: " + token);
    }
}
