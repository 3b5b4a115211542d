package io.runcoord.core;

import java.util.Objects;

/**
 * Normalized result of one dispatch attempt.
 */
public record DispatchResult(
        Kind kind,
        ExecutionHandle handle,
        FailureKind failureKind,
        String reason
) {
    public enum Kind {
        DISPATCHED,
        REJECTED_TRANSIENT,
        REJECTED_PERMANENT
    }

    public static DispatchResult dispatched(ExecutionHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        return new DispatchResult(Kind.DISPATCHED, handle, null, null);
    }

    /**
     * Builds a rejection whose kind follows from the failure's retryability.
     */
    public static DispatchResult rejected(FailureKind failureKind, String reason) {
        Objects.requireNonNull(failureKind, "failureKind must not be null");
        Kind kind = failureKind.retryable() ? Kind.REJECTED_TRANSIENT : Kind.REJECTED_PERMANENT;
        return new DispatchResult(kind, null, failureKind, reason);
    }

    public boolean isDispatched() {
        return kind == Kind.DISPATCHED;
    }
}
