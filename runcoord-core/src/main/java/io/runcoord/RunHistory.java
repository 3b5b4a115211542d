package io.runcoord;

import io.runcoord.core.ExecutionHandle;
import io.runcoord.core.ReportWindow;
import io.runcoord.core.RunStatus;
import io.runcoord.core.RunTrigger;
import io.runcoord.core.ScheduleRun;

import java.time.Instant;
import java.util.List;

/**
 * Execution history of schedules (one row per occurrence or manual run).
 */
public interface RunHistory {

    /**
     * Appends a {@code RUNNING} row with the next per-schedule run number.
     */
    ScheduleRun begin(String scheduleId, RunTrigger trigger, Instant scheduledFor, Instant startedAt, ReportWindow window);

    /**
     * Links a run to the execution the API accepted for it.
     */
    void attachHandle(String runId, ExecutionHandle handle, int attempt);

    void complete(String runId, RunStatus status, int attempts, String failureSummary, Instant completedAt);

    /**
     * True if a {@link RunTrigger#SCHEDULED} run was already recorded for an occurrence scheduled at or
     * after {@code scheduledFor}. Manual runs never count.
     */
    boolean hasScheduledRunSince(String scheduleId, Instant scheduledFor);

    /**
     * Fails scheduled runs of a schedule still {@code RUNNING} that started at or before
     * {@code startedAtOrBefore}.
     *
     * @return number of rows closed
     */
    int abandonRunning(String scheduleId, Instant startedAtOrBefore, String summary, Instant completedAt);

    /**
     * Most recent runs first.
     */
    List<ScheduleRun> listRuns(String scheduleId, int limit);
}
