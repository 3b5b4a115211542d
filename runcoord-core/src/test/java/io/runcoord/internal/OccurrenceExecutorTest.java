package io.runcoord.internal;

import io.runcoord.CredentialProvider;
import io.runcoord.ExecutionApi;
import io.runcoord.FailureNotifier;
import io.runcoord.core.ExecutionApiException;
import io.runcoord.core.ExecutionHandle;
import io.runcoord.core.FailureKind;
import io.runcoord.core.Occurrence;
import io.runcoord.core.OccurrenceOutcome;
import io.runcoord.core.RunStatus;
import io.runcoord.core.Schedule;
import io.runcoord.core.ScheduleRun;
import io.runcoord.core.ScheduleStatus;
import io.runcoord.core.Token;
import io.runcoord.core.WindowConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OccurrenceExecutorTest {

    private static final Instant T0 = Instant.parse("2025-09-08T09:00:00Z");
    private static final Instant NEXT_MONDAY = Instant.parse("2025-09-15T09:00:00Z");

    private InMemoryScheduleStore store;
    private InMemoryRunHistory history;
    private ExecutionApi api;
    private FailureNotifier notifier;
    private MutableClock clock;
    private ExecutorService callExecutor;
    private List<Duration> scheduledDelays;
    private ExecutionDispatcher dispatcher;
    private OccurrenceExecutor executor;
    private OccurrenceExecutor.RetryScheduler inline;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        history = new InMemoryRunHistory();
        api = mock(ExecutionApi.class);
        notifier = mock(FailureNotifier.class);
        clock = new MutableClock(T0);
        callExecutor = Executors.newCachedThreadPool();
        scheduledDelays = new ArrayList<>();

        CredentialProvider credentials = mock(CredentialProvider.class);
        when(credentials.getValidToken("user-1")).thenReturn(new Token("access", null, null));

        dispatcher = new ExecutionDispatcher(credentials, api, new ExecutionRequestFactory(), history,
                Duration.ofSeconds(5), callExecutor);

        // runs retries inline after moving the clock forward by the requested delay
        inline = (task, delay) -> {
            scheduledDelays.add(delay);
            clock.advance(delay);
            task.run();
        };

        executor = new OccurrenceExecutor(store, history, dispatcher, new RetryController(), notifier, inline, clock);
    }

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    private Schedule weekly(boolean notifyOnFailure) {
        return Schedule.builder("s-1")
                .userId("user-1")
                .instanceId("instance-1")
                .queryId("query-1")
                .cronExpression("0 9 * * 1")
                .nextRunAt(T0)
                .window(WindowConfig.fixed(30))
                .notifyOnFailure(notifyOnFailure)
                .build();
    }

    private Occurrence claim(Schedule schedule) {
        store.put(schedule);
        return new ClaimCoordinator(store, history, Duration.ofSeconds(30))
                .tryClaim(store.get(schedule.id()), T0)
                .occurrence();
    }

    @Test
    void firstAttemptSuccessShouldRecordSucceeded() {
        Schedule schedule = weekly(false);
        Occurrence occurrence = claim(schedule);
        when(api.dispatch(any())).thenReturn(new ExecutionHandle("exec-1"));
        AtomicInteger finished = new AtomicInteger();

        executor.execute(schedule, occurrence, finished::incrementAndGet);

        Schedule row = store.get("s-1");
        assertEquals(ScheduleStatus.SUCCEEDED, row.status());
        assertEquals(1, row.attemptCount());
        assertEquals(NEXT_MONDAY, row.nextRunAt());
        assertEquals(1, finished.get());

        ScheduleRun run = history.listRuns("s-1", 1).get(0);
        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals("exec-1", run.executionHandle());
        assertEquals(Instant.parse("2025-08-25T09:00:00Z"), run.windowEnd());
        assertEquals(Instant.parse("2025-07-26T09:00:00Z"), run.windowStart());
    }

    @Test
    void persistentServerErrorsShouldBackOffThenFailOnTheFourthAttempt() {
        Schedule schedule = weekly(true);
        Occurrence occurrence = claim(schedule);
        when(api.dispatch(any())).thenThrow(new ExecutionApiException(503, "unavailable"));
        AtomicInteger finished = new AtomicInteger();

        executor.execute(schedule, occurrence, finished::incrementAndGet);

        verify(api, times(4)).dispatch(any());
        assertEquals(List.of(Duration.ofSeconds(10), Duration.ofSeconds(20), Duration.ofSeconds(40)), scheduledDelays);

        Schedule row = store.get("s-1");
        assertEquals(ScheduleStatus.FAILED, row.status());
        assertEquals(4, row.attemptCount());
        // failing an occurrence never moves the schedule's cadence
        assertEquals(NEXT_MONDAY, row.nextRunAt());
        assertEquals(1, finished.get());

        ScheduleRun run = history.listRuns("s-1", 1).get(0);
        assertEquals(RunStatus.FAILED, run.status());
        assertEquals(4, run.attemptCount());
        assertEquals("The execution service reported an internal error (after 4 attempts)", run.failureSummary());

        ArgumentCaptor<OccurrenceOutcome> outcome = ArgumentCaptor.forClass(OccurrenceOutcome.class);
        verify(notifier).onTerminalFailure(eq(schedule), any(), outcome.capture());
        assertEquals(FailureKind.SERVER_ERROR, outcome.getValue().failureKind());
    }

    @Test
    void permanentFailureShouldNotRetry() {
        Schedule schedule = weekly(false);
        Occurrence occurrence = claim(schedule);
        when(api.dispatch(any())).thenThrow(new ExecutionApiException(401, "unauthorized"));

        executor.execute(schedule, occurrence, () -> {
        });

        verify(api, times(1)).dispatch(any());
        assertTrue(scheduledDelays.isEmpty());
        assertEquals(ScheduleStatus.FAILED, store.get("s-1").status());
        assertEquals(NEXT_MONDAY, store.get("s-1").nextRunAt());
        verify(notifier, never()).onTerminalFailure(any(), any(), any());
    }

    @Test
    void transientFailureFollowedBySuccessShouldSucceedOnTheSecondAttempt() {
        Schedule schedule = weekly(false);
        Occurrence occurrence = claim(schedule);
        when(api.dispatch(any()))
                .thenThrow(new ExecutionApiException(429, "throttled"))
                .thenReturn(new ExecutionHandle("exec-2"));

        executor.execute(schedule, occurrence, () -> {
        });

        assertEquals(List.of(Duration.ofSeconds(10)), scheduledDelays);
        assertEquals(ScheduleStatus.SUCCEEDED, store.get("s-1").status());
        assertEquals(2, store.get("s-1").attemptCount());
        assertEquals("exec-2", history.listRuns("s-1", 1).get(0).executionHandle());
    }

    @Test
    void retryAfterRecoveryReleasedTheClaimShouldBeDropped() {
        Schedule schedule = weekly(false);
        Occurrence occurrence = claim(schedule);
        when(api.dispatch(any())).thenAnswer(inv -> {
            // a recovery scan on another instance releases the claim while we back off
            store.tryRecover("s-1", occurrence.claimedAt(), Instant.MAX, null);
            throw new ExecutionApiException(500, "boom");
        });
        AtomicInteger finished = new AtomicInteger();

        executor.execute(schedule, occurrence, finished::incrementAndGet);

        verify(api, times(1)).dispatch(any());
        assertEquals(ScheduleStatus.IDLE, store.get("s-1").status());
        assertEquals(1, finished.get());
    }

    @Test
    void invalidWindowShouldFailWithoutCallingTheApi() {
        Schedule schedule = weekly(false).toBuilder().window(WindowConfig.rolling(0)).build();
        Occurrence occurrence = claim(schedule);
        AtomicInteger finished = new AtomicInteger();

        executor.execute(schedule, occurrence, finished::incrementAndGet);

        verify(api, never()).dispatch(any());
        assertEquals(ScheduleStatus.FAILED, store.get("s-1").status());
        assertEquals(1, finished.get());
        assertTrue(history.all().isEmpty());
    }

    @Test
    void claimStolenBeforeTheFirstAttemptShouldNotDispatch() {
        Schedule schedule = weekly(false);
        Occurrence occurrence = claim(schedule);
        store.tryRecover("s-1", occurrence.claimedAt(), Instant.MAX, null);

        executor.execute(schedule, occurrence, () -> {
        });

        verify(api, never()).dispatch(any());
        assertEquals(ScheduleStatus.IDLE, store.get("s-1").status());
    }

    @Test
    void longOccurrenceShouldSurviveARecoveryScanDuringItsLastAttempt() {
        Schedule schedule = weekly(false);
        Occurrence occurrence = claim(schedule);
        RecoveryMonitor recovery = new RecoveryMonitor(store, history, Duration.ofMinutes(5), 3);
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger released = new AtomicInteger(-1);
        when(api.dispatch(any())).thenAnswer(inv -> {
            // every call takes a full minute
            clock.advance(Duration.ofSeconds(60));
            if (calls.incrementAndGet() < 4) {
                throw new ExecutionApiException(503, "unavailable");
            }
            released.set(recovery.recoverOnce(clock.instant()));
            return new ExecutionHandle("exec-ok");
        });

        executor.execute(schedule, occurrence, () -> {
        });

        // claimed at T0, the fourth call returns at T0 + 310s
        assertEquals(T0.plusSeconds(310), clock.instant());
        assertEquals(0, released.get());
        assertEquals(ScheduleStatus.SUCCEEDED, store.get("s-1").status());
        assertEquals(0, store.get("s-1").recoveryCount());

        ScheduleRun run = history.listRuns("s-1", 1).get(0);
        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals("exec-ok", run.executionHandle());
    }

    @Test
    void outcomesShouldMaintainRunStatistics() {
        Schedule schedule = weekly(false).toBuilder()
                .executionCount(5)
                .successCount(3)
                .failureCount(2)
                .consecutiveFailures(2)
                .build();
        Occurrence occurrence = claim(schedule);
        when(api.dispatch(any())).thenReturn(new ExecutionHandle("exec-1"));

        executor.execute(schedule, occurrence, () -> {
        });

        Schedule row = store.get("s-1");
        assertEquals(6, row.executionCount());
        assertEquals(4, row.successCount());
        assertEquals(2, row.failureCount());
        assertEquals(0, row.consecutiveFailures());
        assertTrue(row.active());
    }

    @Test
    void reachingTheFailureThresholdShouldPauseAnOptedInSchedule() {
        Schedule schedule = weekly(false).toBuilder()
                .autoPauseOnFailure(true)
                .failureThreshold(2)
                .consecutiveFailures(1)
                .failureCount(1)
                .executionCount(1)
                .build();
        Occurrence occurrence = claim(schedule);
        when(api.dispatch(any())).thenThrow(new ExecutionApiException(403, "forbidden"));

        executor.execute(schedule, occurrence, () -> {
        });

        Schedule row = store.get("s-1");
        assertEquals(ScheduleStatus.FAILED, row.status());
        assertEquals(2, row.consecutiveFailures());
        assertEquals(2, row.failureCount());
        assertEquals(2, row.executionCount());
        assertFalse(row.active());
        assertTrue(store.listDue(NEXT_MONDAY).isEmpty());
    }

    @Test
    void failuresBelowTheThresholdShouldNotPause() {
        Schedule schedule = weekly(false).toBuilder().autoPauseOnFailure(true).build();
        Occurrence occurrence = claim(schedule);
        when(api.dispatch(any())).thenThrow(new ExecutionApiException(403, "forbidden"));

        executor.execute(schedule, occurrence, () -> {
        });

        assertEquals(1, store.get("s-1").consecutiveFailures());
        assertTrue(store.get("s-1").active());
    }

    @Test
    void historyErrorAfterTheOutcomeShouldNotCompleteTwice() {
        InMemoryRunHistory brokenHistory = new InMemoryRunHistory() {
            @Override
            public void complete(String runId, RunStatus status, int attempts, String failureSummary, Instant completedAt) {
                throw new IllegalStateException("history unavailable");
            }
        };
        OccurrenceExecutor withBrokenHistory =
                new OccurrenceExecutor(store, brokenHistory, dispatcher, new RetryController(), notifier, inline, clock);
        Schedule schedule = weekly(true);
        Occurrence occurrence = claim(schedule);
        when(api.dispatch(any())).thenThrow(new ExecutionApiException(401, "unauthorized"));
        AtomicInteger finished = new AtomicInteger();

        withBrokenHistory.execute(schedule, occurrence, finished::incrementAndGet);

        assertEquals(ScheduleStatus.FAILED, store.get("s-1").status());
        assertEquals(1, store.get("s-1").failureCount());
        verify(notifier, times(1)).onTerminalFailure(eq(schedule), any(), any());
        assertEquals(1, finished.get());
    }

    @Test
    void storeErrorWhileRecordingTheOutcomeShouldNotBeRetriedAsUnexpected() {
        AtomicInteger recordCalls = new AtomicInteger();
        InMemoryScheduleStore brokenStore = new InMemoryScheduleStore() {
            @Override
            public synchronized boolean recordOutcome(String scheduleId, Instant claimedAt, OccurrenceOutcome outcome) {
                recordCalls.incrementAndGet();
                throw new IllegalStateException("store unavailable");
            }
        };
        OccurrenceExecutor withBrokenStore =
                new OccurrenceExecutor(brokenStore, history, dispatcher, new RetryController(), notifier, inline, clock);
        Schedule schedule = weekly(true);
        brokenStore.put(schedule);
        Occurrence occurrence = new ClaimCoordinator(brokenStore, history, Duration.ofSeconds(30))
                .tryClaim(brokenStore.get("s-1"), T0)
                .occurrence();
        when(api.dispatch(any())).thenReturn(new ExecutionHandle("exec-1"));
        AtomicInteger finished = new AtomicInteger();

        withBrokenStore.execute(schedule, occurrence, finished::incrementAndGet);

        assertEquals(1, recordCalls.get());
        verify(notifier, never()).onTerminalFailure(any(), any(), any());
        assertEquals(1, finished.get());
    }
}
