package io.runcoord.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs of a coordinator instance.
 *
 * @param pollEvery                 interval between poll ticks
 * @param dueBuffer                 how far ahead of "now" a schedule already counts as due
 * @param recoveryEvery             interval between stuck-claim scans
 * @param recoveryTimeout           age after which a live claim is considered abandoned
 * @param maxConcurrency            occurrences in flight per instance, retries included
 * @param dispatchTimeout           upper bound of a single execution API call
 * @param repeatedRecoveryThreshold consecutive recoveries of one schedule that trigger a warning
 * @param workerId                  identity written next to claims; generated when blank
 */
public record CoordinatorSettings(
        Duration pollEvery,
        Duration dueBuffer,
        Duration recoveryEvery,
        Duration recoveryTimeout,
        int maxConcurrency,
        Duration dispatchTimeout,
        int repeatedRecoveryThreshold,
        String workerId
) {
    public CoordinatorSettings {
        requirePositive(pollEvery, "pollEvery");
        requirePositive(recoveryEvery, "recoveryEvery");
        requirePositive(recoveryTimeout, "recoveryTimeout");
        requirePositive(dispatchTimeout, "dispatchTimeout");
        Objects.requireNonNull(dueBuffer, "dueBuffer must not be null");
        if (dueBuffer.isNegative()) {
            throw new IllegalArgumentException("dueBuffer must not be negative");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
        if (repeatedRecoveryThreshold <= 0) {
            throw new IllegalArgumentException("repeatedRecoveryThreshold must be positive");
        }
    }

    public static CoordinatorSettings defaults() {
        return new CoordinatorSettings(
                Duration.ofSeconds(60),
                Duration.ofSeconds(30),
                Duration.ofSeconds(60),
                Duration.ofMinutes(5),
                10,
                Duration.ofSeconds(60),
                3,
                null
        );
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
