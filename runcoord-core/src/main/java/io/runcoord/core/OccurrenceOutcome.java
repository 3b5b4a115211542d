package io.runcoord.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal result of an occurrence, written back to the schedule row.
 */
public record OccurrenceOutcome(
        ScheduleStatus status,
        int attempts,
        ExecutionHandle handle,
        FailureKind failureKind,
        String summary,
        Instant finishedAt
) {
    public OccurrenceOutcome {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        if (status != ScheduleStatus.SUCCEEDED && status != ScheduleStatus.FAILED) {
            throw new IllegalArgumentException("outcome status must be SUCCEEDED or FAILED: " + status);
        }
    }

    public static OccurrenceOutcome succeeded(int attempts, ExecutionHandle handle, Instant finishedAt) {
        return new OccurrenceOutcome(ScheduleStatus.SUCCEEDED, attempts, handle, null, null, finishedAt);
    }

    public static OccurrenceOutcome failed(int attempts, FailureKind kind, Instant finishedAt) {
        Objects.requireNonNull(kind, "kind must not be null");
        String summary = attempts == 0
                ? kind.summary()
                : kind.summary() + " (after " + attempts + (attempts == 1 ? " attempt)" : " attempts)");
        return new OccurrenceOutcome(ScheduleStatus.FAILED, attempts, null, kind, summary, finishedAt);
    }

    public boolean succeeded() {
        return status == ScheduleStatus.SUCCEEDED;
    }
}
