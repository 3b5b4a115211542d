package io.runcoord.internal;

import io.runcoord.RunHistory;
import io.runcoord.ScheduleStore;
import io.runcoord.core.Schedule;
import io.runcoord.utils.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Releases claims left behind by workers that died mid-occurrence.
 *
 * <p>A worker renews its claim heartbeat at every attempt. A claim whose heartbeat is older than the
 * recovery timeout is reset to {@code IDLE} with a compare-and-swap on the claim timestamp and the
 * heartbeat, so a worker that renews or finishes while the scan runs wins and is not reset. {@code nextRunAt}
 * is only recomputed, relative to now, when it is not already in the future; the claim-time pre-advance
 * normally makes that unnecessary and also rules out catch-up bursts.
 */
public class RecoveryMonitor {
    private static final Logger log = LoggerFactory.getLogger(RecoveryMonitor.class);

    static final String ABANDONED_SUMMARY = "Execution abandoned by a stopped worker";

    private final ScheduleStore store;
    private final RunHistory history;
    private final Duration recoveryTimeout;
    private final int repeatedRecoveryThreshold;

    public RecoveryMonitor(ScheduleStore store, RunHistory history, Duration recoveryTimeout, int repeatedRecoveryThreshold) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout must not be null");
        this.repeatedRecoveryThreshold = repeatedRecoveryThreshold;
    }

    /**
     * @return number of schedules released
     */
    public int recoverOnce(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Instant cutoff = now.minus(recoveryTimeout);

        List<Schedule> stuck = store.findStuck(cutoff);
        if (stuck.isEmpty()) {
            log.debug("runcoord no stuck claims with heartbeat older than {}", cutoff);
            return 0;
        }

        int recovered = 0;
        for (Schedule schedule : stuck) {
            try {
                if (recover(schedule, now, cutoff)) {
                    recovered++;
                }
            } catch (Exception e) {
                log.error("runcoord failed to recover scheduleId={} msg={}", schedule.id(), e.getMessage(), e);
            }
        }

        log.info("runcoord recovery scan stuck={} recovered={}", stuck.size(), recovered);
        return recovered;
    }

    private boolean recover(Schedule schedule, Instant now, Instant cutoff) {
        Instant claimedAt = schedule.lastRunAt();
        if (claimedAt == null) {
            log.warn("runcoord live claim without claim timestamp scheduleId={} status={}", schedule.id(), schedule.status());
            return false;
        }

        Instant nextRunAt = schedule.nextRunAt() != null && schedule.nextRunAt().isAfter(now)
                ? null
                : CronSchedules.nextAfter(schedule.cronExpression(), schedule.timezone(), now);

        if (!store.tryRecover(schedule.id(), claimedAt, cutoff, nextRunAt)) {
            log.debug("runcoord claim renewed or finished during recovery scheduleId={} claimedAt={}", schedule.id(), claimedAt);
            return false;
        }

        int closed = history.abandonRunning(schedule.id(), claimedAt, ABANDONED_SUMMARY, now);

        int recoveries = schedule.recoveryCount() + 1;
        if (recoveries >= repeatedRecoveryThreshold) {
            log.warn("runcoord schedule repeatedly stuck scheduleId={} recoveries={} claimedAt={} heartbeat={} status={}",
                    schedule.id(), recoveries, claimedAt, schedule.claimHeartbeat(), schedule.status());
        } else {
            log.info("runcoord recovered stuck claim scheduleId={} claimedAt={} heartbeat={} status={} runsClosed={} nextRunAt={}",
                    schedule.id(), claimedAt, schedule.claimHeartbeat(), schedule.status(), closed,
                    nextRunAt != null ? nextRunAt : schedule.nextRunAt());
        }
        return true;
    }
}
