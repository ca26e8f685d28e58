package dev.agentos.model;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one agent invocation, or of a step that never reached one.
 */
public record AgentResult(
    ResultStatus status,
    Object payload,
    Duration duration,
    List<SideEffect> sideEffects,
    ErrorKind errorKind,   // null unless status is FAILURE
    String message
) {
    public AgentResult {
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    public static AgentResult success(Object payload, Duration duration, List<SideEffect> sideEffects) {
        return new AgentResult(ResultStatus.SUCCESS, payload, duration, sideEffects, null, null);
    }

    public static AgentResult failure(ErrorKind kind, String message, Duration duration,
                                      List<SideEffect> sideEffects) {
        return new AgentResult(ResultStatus.FAILURE, null, duration, sideEffects, kind, message);
    }

    public static AgentResult failure(ErrorKind kind, String message) {
        return failure(kind, message, Duration.ZERO, List.of());
    }

    public static AgentResult skipped(String reason) {
        return new AgentResult(ResultStatus.SKIPPED, null, Duration.ZERO, List.of(), null, reason);
    }

    public boolean succeeded() {
        return status == ResultStatus.SUCCESS;
    }
}
