package io.runcoord.internal;

import io.runcoord.ScheduleStore;
import io.runcoord.core.ClaimResult;
import io.runcoord.core.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * One poll tick: list due schedules, claim them, and hand each claimed occurrence to the worker pool.
 *
 * <p>Holds no state between ticks. {@code capacity} bounds the occurrences in flight, retries included;
 * a permit is taken before claiming and returned when the occurrence finishes.
 */
public class PollLoop {
    private static final Logger log = LoggerFactory.getLogger(PollLoop.class);

    private final ScheduleStore store;
    private final ClaimCoordinator claims;
    private final OccurrenceExecutor occurrences;
    private final Executor workerPool;
    private final Semaphore capacity;
    private final Duration dueBuffer;

    public PollLoop(
            ScheduleStore store,
            ClaimCoordinator claims,
            OccurrenceExecutor occurrences,
            Executor workerPool,
            Semaphore capacity,
            Duration dueBuffer
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.claims = Objects.requireNonNull(claims, "claims must not be null");
        this.occurrences = Objects.requireNonNull(occurrences, "occurrences must not be null");
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool must not be null");
        this.capacity = Objects.requireNonNull(capacity, "capacity must not be null");
        this.dueBuffer = Objects.requireNonNull(dueBuffer, "dueBuffer must not be null");
    }

    /**
     * Summary of one tick.
     */
    public record PollReport(int due, int claimed, int conflicts, int skipped, int errors) {
    }

    /**
     * Store failures while listing propagate to the caller; failures of a single schedule are logged
     * and do not stop the tick.
     */
    public PollReport pollOnce(Instant now) {
        List<Schedule> due = store.listDue(now.plus(dueBuffer));
        if (due.isEmpty()) {
            log.debug("runcoord no due schedules now={}", now);
            return new PollReport(0, 0, 0, 0, 0);
        }
        log.info("runcoord found due schedules count={} now={}", due.size(), now);

        int claimed = 0;
        int conflicts = 0;
        int skipped = 0;
        int errors = 0;

        for (Schedule schedule : due) {
            if (!capacity.tryAcquire()) {
                log.debug("runcoord at capacity, leaving remaining schedules for the next tick remaining={}",
                        due.size() - claimed - conflicts - skipped - errors);
                break;
            }

            boolean handedOff = false;
            try {
                ClaimResult result = claims.tryClaim(schedule, now);
                switch (result.status()) {
                    case CLAIMED -> {
                        workerPool.execute(() -> occurrences.execute(schedule, result.occurrence(), capacity::release));
                        handedOff = true;
                        claimed++;
                    }
                    case CONFLICT -> conflicts++;
                    case ALREADY_RAN, NOT_DUE -> skipped++;
                }
            } catch (Exception e) {
                errors++;
                log.error("runcoord failed to process scheduleId={} msg={}", schedule.id(), e.getMessage(), e);
            } finally {
                if (!handedOff) {
                    capacity.release();
                }
            }
        }

        return new PollReport(due.size(), claimed, conflicts, skipped, errors);
    }
}
