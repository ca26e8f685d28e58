package dev.agentos.model;

import java.time.Duration;

/**
 * How many extra attempts a failed step gets, and how long to wait between them.
 */
public record RetryPolicy(int count, Duration backoff) {

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO);
    }

    public static RetryPolicy of(int count, Duration backoff) {
        return new RetryPolicy(count, backoff);
    }

    public int maxAttempts() {
        return 1 + Math.max(0, count);
    }
}
