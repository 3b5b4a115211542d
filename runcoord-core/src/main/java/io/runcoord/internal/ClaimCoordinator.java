package io.runcoord.internal;

import io.runcoord.RunHistory;
import io.runcoord.ScheduleStore;
import io.runcoord.core.ClaimResult;
import io.runcoord.core.Occurrence;
import io.runcoord.core.Schedule;
import io.runcoord.utils.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Decides which of several concurrently polling workers executes a due occurrence.
 *
 * <p>The claim is a single conditional update on the schedule row, keyed on the {@code lastRunAt}
 * value read by {@code listDue}. The same update moves {@code nextRunAt} to the next cron fire time,
 * so a worker that dies between claim and dispatch can never cause the occurrence to be claimed
 * again.
 */
public class ClaimCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ClaimCoordinator.class);

    private final ScheduleStore store;
    private final RunHistory history;
    private final Duration dueBuffer;

    public ClaimCoordinator(ScheduleStore store, RunHistory history, Duration dueBuffer) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.dueBuffer = Objects.requireNonNull(dueBuffer, "dueBuffer must not be null");
    }

    public ClaimResult tryClaim(Schedule schedule, Instant now) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Instant scheduledFor = schedule.nextRunAt();
        if (scheduledFor == null || !schedule.active()) {
            return ClaimResult.notDue();
        }
        if (scheduledFor.isAfter(now.plus(dueBuffer))) {
            log.debug("runcoord schedule not due yet scheduleId={} nextRunAt={} now={}",
                    schedule.id(), scheduledFor, now);
            return ClaimResult.notDue();
        }

        // guards against a run recorded for this occurrence by a worker whose clock disagrees with ours
        if (history.hasScheduledRunSince(schedule.id(), scheduledFor)) {
            skipToNextOccurrence(schedule, now);
            return ClaimResult.alreadyRan();
        }

        // stored with millisecond precision; the claim token must compare equal after a round trip
        Instant claimedAt = now.truncatedTo(ChronoUnit.MILLIS);
        Instant base = scheduledFor.isAfter(claimedAt) ? scheduledFor : claimedAt;
        Instant provisionalNextRunAt = CronSchedules.nextAfter(schedule.cronExpression(), schedule.timezone(), base);

        boolean won = store.tryClaim(schedule.id(), schedule.lastRunAt(), claimedAt, provisionalNextRunAt);
        if (!won) {
            log.debug("runcoord claim conflict scheduleId={} expectedLastRunAt={}", schedule.id(), schedule.lastRunAt());
            return ClaimResult.conflict();
        }

        log.info("runcoord claimed scheduleId={} scheduledFor={} claimedAt={} nextRunAt={}",
                schedule.id(), scheduledFor, claimedAt, provisionalNextRunAt);
        return ClaimResult.claimed(Occurrence.claimed(schedule.id(), scheduledFor, claimedAt));
    }

    // otherwise a nextRunAt moved back behind recorded history stays due on every tick
    private void skipToNextOccurrence(Schedule schedule, Instant now) {
        Instant scheduledFor = schedule.nextRunAt();
        Instant base = scheduledFor.isAfter(now) ? scheduledFor : now;
        Instant next = CronSchedules.nextAfter(schedule.cronExpression(), schedule.timezone(), base);

        if (store.advanceNextRunAt(schedule.id(), scheduledFor, next)) {
            log.info("runcoord run already recorded, skipping occurrence scheduleId={} scheduledFor={} nextRunAt={}",
                    schedule.id(), scheduledFor, next);
        } else {
            log.debug("runcoord run already recorded, schedule changed concurrently scheduleId={} scheduledFor={}",
                    schedule.id(), scheduledFor);
        }
    }
}
