package io.runcoord.internal;

import io.runcoord.FailureNotifier;
import io.runcoord.RunHistory;
import io.runcoord.ScheduleStore;
import io.runcoord.core.DispatchResult;
import io.runcoord.core.FailureKind;
import io.runcoord.core.Occurrence;
import io.runcoord.core.OccurrenceOutcome;
import io.runcoord.core.ReportWindow;
import io.runcoord.core.RetryDecision;
import io.runcoord.core.RunStatus;
import io.runcoord.core.RunTrigger;
import io.runcoord.core.Schedule;
import io.runcoord.core.ScheduleRun;
import io.runcoord.utils.WindowCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives one claimed occurrence through {@code Attempting -> Succeeded | Exhausted}.
 *
 * <p>Retries are handed to a {@link RetryScheduler} instead of sleeping, so a backing-off occurrence
 * never holds a worker thread. {@code onFinished} runs exactly once, when the occurrence reaches a
 * terminal state or is given up to recovery.
 */
public class OccurrenceExecutor {
    private static final Logger log = LoggerFactory.getLogger(OccurrenceExecutor.class);

    /**
     * Runs a task after a delay.
     */
    @FunctionalInterface
    public interface RetryScheduler {
        void schedule(Runnable task, Duration delay);
    }

    private final ScheduleStore store;
    private final RunHistory history;
    private final ExecutionDispatcher dispatcher;
    private final RetryController retryController;
    private final FailureNotifier notifier;
    private final RetryScheduler retryScheduler;
    private final Clock clock;

    public OccurrenceExecutor(
            ScheduleStore store,
            RunHistory history,
            ExecutionDispatcher dispatcher,
            RetryController retryController,
            FailureNotifier notifier,
            RetryScheduler retryScheduler,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.retryController = Objects.requireNonNull(retryController, "retryController must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void execute(Schedule schedule, Occurrence claimed, Runnable onFinished) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(claimed, "claimed must not be null");
        Objects.requireNonNull(onFinished, "onFinished must not be null");

        ReportWindow window;
        try {
            window = WindowCalculator.computeWindow(schedule, clock.instant());
        } catch (IllegalArgumentException e) {
            log.error("runcoord invalid window configuration scheduleId={} scheduledFor={} msg={}",
                    schedule.id(), claimed.scheduledFor(), e.getMessage());
            try {
                complete(schedule, claimed, OccurrenceOutcome.failed(0, FailureKind.INVALID_CONFIGURATION, clock.instant()));
            } finally {
                onFinished.run();
            }
            return;
        }

        Occurrence occurrence = claimed.withWindow(window);
        try {
            ScheduleRun run = history.begin(
                    schedule.id(),
                    RunTrigger.SCHEDULED,
                    claimed.scheduledFor(),
                    claimed.claimedAt(),
                    window
            );
            occurrence = occurrence.withRunId(run.runId());
        } catch (RuntimeException e) {
            log.error("runcoord could not record run scheduleId={} scheduledFor={} msg={}",
                    schedule.id(), claimed.scheduledFor(), e.getMessage(), e);
        }

        attempt(schedule, occurrence, 1, onFinished);
    }

    private void attempt(Schedule schedule, Occurrence occurrence, int attempt, Runnable onFinished) {
        boolean finished = true;
        boolean completing = false;
        try {
            Instant renewedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            if (!store.markExecuting(schedule.id(), occurrence.claimedAt(), attempt, renewedAt)) {
                log.warn("runcoord claim no longer live, dropping occurrence scheduleId={} scheduledFor={} attempt={}",
                        schedule.id(), occurrence.scheduledFor(), attempt);
                return;
            }

            log.info("runcoord attempt scheduleId={} scheduledFor={} attempt={} window={}",
                    schedule.id(), occurrence.scheduledFor(), attempt, occurrence.window());

            DispatchResult result = dispatcher.dispatch(schedule, occurrence, attempt);
            if (result.isDispatched()) {
                log.info("runcoord dispatched scheduleId={} scheduledFor={} attempt={} handle={}",
                        schedule.id(), occurrence.scheduledFor(), attempt, result.handle());
                completing = true;
                complete(schedule, occurrence, OccurrenceOutcome.succeeded(attempt, result.handle(), clock.instant()));
                return;
            }

            RetryDecision decision = retryController.decide(attempt, result.failureKind(), schedule.maxAttempts());
            switch (decision.action()) {
                case RETRY -> {
                    log.warn("runcoord transient failure, retrying scheduleId={} scheduledFor={} attempt={} kind={} retryIn={} reason={}",
                            schedule.id(), occurrence.scheduledFor(), attempt, result.failureKind(),
                            decision.delay(), result.reason());
                    retryScheduler.schedule(() -> attempt(schedule, occurrence, attempt + 1, onFinished), decision.delay());
                    finished = false;
                    return;
                }
                case EXHAUSTED -> log.error("runcoord retries exhausted scheduleId={} scheduledFor={} attempt={} kind={} reason={}",
                        schedule.id(), occurrence.scheduledFor(), attempt, result.failureKind(), result.reason());
                case ABORT -> log.error("runcoord permanent failure scheduleId={} scheduledFor={} attempt={} kind={} reason={}",
                        schedule.id(), occurrence.scheduledFor(), attempt, result.failureKind(), result.reason());
            }
            completing = true;
            complete(schedule, occurrence, OccurrenceOutcome.failed(attempt, result.failureKind(), clock.instant()));
        } catch (RejectedExecutionException e) {
            log.warn("runcoord coordinator stopping, leaving occurrence to recovery scheduleId={} scheduledFor={} attempt={}",
                    schedule.id(), occurrence.scheduledFor(), attempt);
        } catch (Exception e) {
            if (completing) {
                log.error("runcoord completing occurrence failed scheduleId={} scheduledFor={} attempt={} msg={}",
                        schedule.id(), occurrence.scheduledFor(), attempt, e.getMessage(), e);
                return;
            }
            log.error("runcoord occurrence failed unexpectedly scheduleId={} scheduledFor={} attempt={} msg={}",
                    schedule.id(), occurrence.scheduledFor(), attempt, e.getMessage(), e);
            try {
                complete(schedule, occurrence, OccurrenceOutcome.failed(attempt, FailureKind.UNEXPECTED, clock.instant()));
            } catch (Exception storeEx) {
                log.error("runcoord recordOutcome failed scheduleId={} msg={}", schedule.id(), storeEx.getMessage(), storeEx);
            }
        } finally {
            if (finished) {
                onFinished.run();
            }
        }
    }

    private void complete(Schedule schedule, Occurrence occurrence, OccurrenceOutcome outcome) {
        boolean recorded = store.recordOutcome(schedule.id(), occurrence.claimedAt(), outcome);
        if (!recorded) {
            log.warn("runcoord outcome not recorded, claim no longer live scheduleId={} scheduledFor={} status={}",
                    schedule.id(), occurrence.scheduledFor(), outcome.status());
        } else if (!outcome.succeeded() && schedule.pausesOnNextFailure()) {
            log.warn("runcoord schedule paused after repeated failures scheduleId={} consecutiveFailures={} threshold={}",
                    schedule.id(), schedule.consecutiveFailures() + 1, schedule.failureThreshold());
        }

        if (occurrence.runId() != null) {
            try {
                history.complete(
                        occurrence.runId(),
                        outcome.succeeded() ? RunStatus.COMPLETED : RunStatus.FAILED,
                        outcome.attempts(),
                        outcome.summary(),
                        outcome.finishedAt()
                );
            } catch (RuntimeException e) {
                log.error("runcoord could not complete run scheduleId={} runId={} msg={}",
                        schedule.id(), occurrence.runId(), e.getMessage(), e);
            }
        }

        if (!outcome.succeeded() && schedule.notifyOnFailure()) {
            try {
                notifier.onTerminalFailure(schedule, occurrence, outcome);
            } catch (RuntimeException e) {
                log.error("runcoord failure notification failed scheduleId={} msg={}", schedule.id(), e.getMessage(), e);
            }
        }
    }
}
