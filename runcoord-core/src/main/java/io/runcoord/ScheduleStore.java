package io.runcoord;

import io.runcoord.core.OccurrenceOutcome;
import io.runcoord.core.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence surface of the coordinator.
 *
 * <p>Every write to {@code status}, {@code lastRunAt} or {@code nextRunAt} goes through one of the
 * conditional operations below. Each of them must be a single atomic compare-and-swap on the row:
 * the stored {@code lastRunAt} is the claim token, and an operation that finds a different token
 * affects nothing and returns {@code false}.
 */
public interface ScheduleStore {

    /**
     * Active schedules in a claimable status whose {@code nextRunAt <= dueBefore}, earliest first.
     */
    List<Schedule> listDue(Instant dueBefore);

    Optional<Schedule> findById(String scheduleId);

    /**
     * Claims one occurrence: sets {@code status = CLAIMED}, {@code lastRunAt} and
     * {@code claimRenewedAt} to {@code claimedAt}, {@code nextRunAt = newNextRunAt} and
     * {@code attemptCount = 0}, only if the stored
     * {@code lastRunAt} still equals {@code expectedLastRunAt} (both may be null) and the schedule is
     * active and claimable.
     *
     * @return true if this caller won the claim
     */
    boolean tryClaim(String scheduleId, Instant expectedLastRunAt, Instant claimedAt, Instant newNextRunAt);

    /**
     * Moves a live claim to {@code EXECUTING}, records the attempt number and renews the claim
     * heartbeat ({@code claimRenewedAt = renewedAt}).
     *
     * @return false if the claim identified by {@code claimedAt} is no longer live
     */
    boolean markExecuting(String scheduleId, Instant claimedAt, int attempt, Instant renewedAt);

    /**
     * Writes the terminal outcome of the claimed occurrence and updates the run statistics
     * (execution, success and failure counts, consecutive failures). A failure that brings
     * {@code consecutiveFailures} to {@code failureThreshold} on a schedule with
     * {@code autoPauseOnFailure} also sets {@code active = false}. {@code nextRunAt} is left untouched.
     *
     * @return false if the claim identified by {@code claimedAt} is no longer live
     */
    boolean recordOutcome(String scheduleId, Instant claimedAt, OccurrenceOutcome outcome);

    /**
     * Schedules in {@code CLAIMED} or {@code EXECUTING} whose claim heartbeat ({@code claimRenewedAt},
     * or {@code lastRunAt} when absent) is older than {@code renewedBefore}.
     */
    List<Schedule> findStuck(Instant renewedBefore);

    /**
     * Releases an abandoned claim: {@code status = IDLE}, recovery counter incremented and, when
     * {@code nextRunAtOrNull} is not null, {@code nextRunAt} replaced. Applies only while the claim
     * identified by {@code claimedAt} is still live and its heartbeat is still older than
     * {@code renewedBefore}.
     */
    boolean tryRecover(String scheduleId, Instant claimedAt, Instant renewedBefore, Instant nextRunAtOrNull);

    /**
     * Moves {@code nextRunAt} of an unclaimed schedule forward, only if it still equals
     * {@code expectedNextRunAt} and the schedule is in a claimable status.
     */
    boolean advanceNextRunAt(String scheduleId, Instant expectedNextRunAt, Instant newNextRunAt);
}
