package io.runcoord.internal;

import io.runcoord.core.FailureKind;
import io.runcoord.core.RetryDecision;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy of one occurrence.
 *
 * <p>Non-retryable failures end the occurrence at once. Retryable failures are retried after
 * 10s, 20s, 40s... capped at 60s, until {@code maxAttempts} retries have been spent; the failure
 * after that exhausts the occurrence.
 */
public class RetryController {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(10);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetryController() {
        this(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    public RetryController(Duration baseDelay, Duration maxDelay) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("delays must satisfy 0 <= baseDelay <= maxDelay");
        }
    }

    /**
     * @param failureNumber 1 for the first failed attempt of the occurrence
     * @param kind          classification of this failure
     * @param maxAttempts   retries allowed after the first attempt
     */
    public RetryDecision decide(int failureNumber, FailureKind kind, int maxAttempts) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (failureNumber < 1) {
            throw new IllegalArgumentException("failureNumber starts at 1: " + failureNumber);
        }
        if (!kind.retryable()) {
            return RetryDecision.abort();
        }
        if (failureNumber > maxAttempts) {
            return RetryDecision.exhausted();
        }
        return RetryDecision.retryAfter(delay(failureNumber));
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    /**
     * Delay before the retry that follows failure {@code failureNumber}.
     */
    public Duration delay(int failureNumber) {
        int exp = Math.max(0, failureNumber - 1);
        exp = Math.min(exp, 20); // avoid overflow
        long ms = Math.min(baseDelay.toMillis() * (1L << exp), maxDelay.toMillis());
        return Duration.ofMillis(ms);
    }
}
