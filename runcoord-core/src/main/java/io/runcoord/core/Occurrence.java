package io.runcoord.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One due firing of a schedule, owned by the worker that claimed it.
 *
 * @param scheduleId   schedule the occurrence belongs to
 * @param scheduledFor the {@code nextRunAt} value the claim consumed
 * @param claimedAt    the {@code lastRunAt} value written by the claim; acts as the claim token
 * @param window       reporting window, null until computed
 * @param runId        run-history row, null until recorded
 */
public record Occurrence(
        String scheduleId,
        Instant scheduledFor,
        Instant claimedAt,
        ReportWindow window,
        String runId
) {
    public Occurrence {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(scheduledFor, "scheduledFor must not be null");
        Objects.requireNonNull(claimedAt, "claimedAt must not be null");
    }

    public static Occurrence claimed(String scheduleId, Instant scheduledFor, Instant claimedAt) {
        return new Occurrence(scheduleId, scheduledFor, claimedAt, null, null);
    }

    public Occurrence withWindow(ReportWindow window) {
        return new Occurrence(scheduleId, scheduledFor, claimedAt, window, runId);
    }

    public Occurrence withRunId(String runId) {
        return new Occurrence(scheduleId, scheduledFor, claimedAt, window, runId);
    }
}
