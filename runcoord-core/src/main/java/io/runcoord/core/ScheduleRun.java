package io.runcoord.core;

import java.time.Instant;

/**
 * One row of a schedule's execution history.
 */
public record ScheduleRun(
        String runId,
        String scheduleId,
        long runNumber,
        RunTrigger trigger,
        Instant scheduledFor,
        Instant startedAt,
        Instant windowStart,
        Instant windowEnd,
        RunStatus status,
        int attemptCount,
        String executionHandle,
        String failureSummary,
        Instant completedAt
) {
}
