package io.runcoord.internal;

import io.runcoord.ScheduleStore;
import io.runcoord.core.OccurrenceOutcome;
import io.runcoord.core.Schedule;
import io.runcoord.core.ScheduleStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Store double whose compare-and-swap operations are serialized by the instance monitor.
 */
class InMemoryScheduleStore implements ScheduleStore {

    private final Map<String, Schedule> rows = new LinkedHashMap<>();
    final AtomicInteger claimAttempts = new AtomicInteger();

    synchronized void put(Schedule schedule) {
        rows.put(schedule.id(), schedule);
    }

    synchronized Schedule get(String id) {
        return rows.get(id);
    }

    @Override
    public synchronized List<Schedule> listDue(Instant dueBefore) {
        List<Schedule> out = new ArrayList<>();
        for (Schedule s : rows.values()) {
            if (s.active() && s.status().isClaimable() && s.nextRunAt() != null && !s.nextRunAt().isAfter(dueBefore)) {
                out.add(s);
            }
        }
        out.sort(Comparator.comparing(Schedule::nextRunAt));
        return out;
    }

    @Override
    public synchronized Optional<Schedule> findById(String scheduleId) {
        return Optional.ofNullable(rows.get(scheduleId));
    }

    @Override
    public synchronized boolean tryClaim(String scheduleId, Instant expectedLastRunAt, Instant claimedAt, Instant newNextRunAt) {
        claimAttempts.incrementAndGet();
        Schedule s = rows.get(scheduleId);
        if (s == null || !s.active() || !s.status().isClaimable() || !Objects.equals(s.lastRunAt(), expectedLastRunAt)) {
            return false;
        }
        rows.put(scheduleId, s.toBuilder()
                .status(ScheduleStatus.CLAIMED)
                .lastRunAt(claimedAt)
                .claimRenewedAt(claimedAt)
                .nextRunAt(newNextRunAt)
                .attemptCount(0)
                .build());
        return true;
    }

    @Override
    public synchronized boolean markExecuting(String scheduleId, Instant claimedAt, int attempt, Instant renewedAt) {
        Schedule s = liveClaim(scheduleId, claimedAt);
        if (s == null) {
            return false;
        }
        rows.put(scheduleId, s.toBuilder()
                .status(ScheduleStatus.EXECUTING)
                .attemptCount(attempt)
                .claimRenewedAt(renewedAt)
                .build());
        return true;
    }

    @Override
    public synchronized boolean recordOutcome(String scheduleId, Instant claimedAt, OccurrenceOutcome outcome) {
        Schedule s = liveClaim(scheduleId, claimedAt);
        if (s == null) {
            return false;
        }
        Schedule.Builder b = s.toBuilder()
                .status(outcome.status())
                .attemptCount(outcome.attempts())
                .recoveryCount(0)
                .executionCount(s.executionCount() + 1);
        if (outcome.succeeded()) {
            b.successCount(s.successCount() + 1).consecutiveFailures(0);
        } else {
            b.failureCount(s.failureCount() + 1).consecutiveFailures(s.consecutiveFailures() + 1);
            if (s.pausesOnNextFailure()) {
                b.active(false);
            }
        }
        rows.put(scheduleId, b.build());
        return true;
    }

    @Override
    public synchronized List<Schedule> findStuck(Instant renewedBefore) {
        List<Schedule> out = new ArrayList<>();
        for (Schedule s : rows.values()) {
            if (s.status().isLiveClaim() && s.claimHeartbeat() != null && s.claimHeartbeat().isBefore(renewedBefore)) {
                out.add(s);
            }
        }
        return out;
    }

    @Override
    public synchronized boolean tryRecover(String scheduleId, Instant claimedAt, Instant renewedBefore, Instant nextRunAtOrNull) {
        Schedule s = liveClaim(scheduleId, claimedAt);
        if (s == null || !s.claimHeartbeat().isBefore(renewedBefore)) {
            return false;
        }
        Schedule.Builder b = s.toBuilder()
                .status(ScheduleStatus.IDLE)
                .recoveryCount(s.recoveryCount() + 1);
        if (nextRunAtOrNull != null) {
            b.nextRunAt(nextRunAtOrNull);
        }
        rows.put(scheduleId, b.build());
        return true;
    }

    @Override
    public synchronized boolean advanceNextRunAt(String scheduleId, Instant expectedNextRunAt, Instant newNextRunAt) {
        Schedule s = rows.get(scheduleId);
        if (s == null || !s.status().isClaimable() || !Objects.equals(s.nextRunAt(), expectedNextRunAt)) {
            return false;
        }
        rows.put(scheduleId, s.toBuilder().nextRunAt(newNextRunAt).build());
        return true;
    }

    private Schedule liveClaim(String scheduleId, Instant claimedAt) {
        Schedule s = rows.get(scheduleId);
        if (s == null || !s.status().isLiveClaim() || !Objects.equals(s.lastRunAt(), claimedAt)) {
            return null;
        }
        return s;
    }
}
