package io.runcoord.core;

import java.time.Duration;

/**
 * What to do after a failed attempt.
 */
public record RetryDecision(Action action, Duration delay) {

    public enum Action {
        /** Try again after {@link #delay()}. */
        RETRY,
        /** Retryable failure, but no attempts left. */
        EXHAUSTED,
        /** Non-retryable failure. */
        ABORT
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(Action.RETRY, delay);
    }

    public static RetryDecision exhausted() {
        return new RetryDecision(Action.EXHAUSTED, Duration.ZERO);
    }

    public static RetryDecision abort() {
        return new RetryDecision(Action.ABORT, Duration.ZERO);
    }

    public boolean shouldRetry() {
        return action == Action.RETRY;
    }
}
