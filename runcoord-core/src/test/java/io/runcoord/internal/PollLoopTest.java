package io.runcoord.internal;

import io.runcoord.core.Schedule;
import io.runcoord.core.ScheduleStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PollLoopTest {

    private static final Instant T0 = Instant.parse("2025-09-08T09:00:00Z");
    private static final Duration DUE_BUFFER = Duration.ofSeconds(30);
    private static final Executor DIRECT = Runnable::run;

    private InMemoryScheduleStore store;
    private InMemoryRunHistory history;
    private OccurrenceExecutor occurrences;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        history = new InMemoryRunHistory();
        occurrences = mock(OccurrenceExecutor.class);
    }

    private PollLoop loop(Semaphore capacity) {
        return new PollLoop(store, new ClaimCoordinator(store, history, DUE_BUFFER), occurrences, DIRECT, capacity, DUE_BUFFER);
    }

    private static Schedule schedule(String id, String cron, Instant nextRunAt) {
        return Schedule.builder(id)
                .userId("user-1")
                .instanceId("instance-1")
                .queryId("query-1")
                .cronExpression(cron)
                .nextRunAt(nextRunAt)
                .build();
    }

    @Test
    void brokenScheduleShouldNotStopTheTick() {
        store.put(schedule("a", "0 9 * * 1", T0.minusSeconds(2)));
        store.put(schedule("broken", "not a cron", T0.minusSeconds(1)));
        store.put(schedule("c", "0 9 * * *", T0));
        Semaphore capacity = new Semaphore(10);

        PollLoop.PollReport report = loop(capacity).pollOnce(T0);

        assertEquals(3, report.due());
        assertEquals(2, report.claimed());
        assertEquals(1, report.errors());
        verify(occurrences, times(2)).execute(any(), any(), any());
        verify(occurrences, never()).execute(argThat(s -> s.id().equals("broken")), any(), any());
        assertEquals(ScheduleStatus.IDLE, store.get("broken").status());
        // permits of handed-off occurrences stay taken until they finish
        assertEquals(8, capacity.availablePermits());
    }

    @Test
    void finishedOccurrencesShouldReturnTheirPermit() {
        doAnswer(inv -> {
            Runnable onFinished = inv.getArgument(2);
            onFinished.run();
            return null;
        }).when(occurrences).execute(any(), any(), any());
        store.put(schedule("a", "0 9 * * 1", T0));
        Semaphore capacity = new Semaphore(2);

        assertEquals(1, loop(capacity).pollOnce(T0).claimed());
        assertEquals(2, capacity.availablePermits());
    }

    @Test
    void fullCapacityShouldLeaveSchedulesForTheNextTick() {
        store.put(schedule("a", "0 9 * * 1", T0.minusSeconds(1)));
        store.put(schedule("b", "0 9 * * 1", T0));
        Semaphore capacity = new Semaphore(1);

        PollLoop.PollReport report = loop(capacity).pollOnce(T0);

        assertEquals(1, report.claimed());
        assertEquals(ScheduleStatus.CLAIMED, store.get("a").status());
        assertEquals(ScheduleStatus.IDLE, store.get("b").status());
        assertEquals(T0, store.get("b").nextRunAt());
    }

    @Test
    void nothingDueShouldBeANoop() {
        store.put(schedule("a", "0 9 * * 1", T0.plus(Duration.ofHours(1))));

        assertEquals(0, loop(new Semaphore(1)).pollOnce(T0).due());
        assertEquals(0, store.claimAttempts.get());
    }

    @Test
    void storeFailureWhileListingShouldPropagate() {
        InMemoryScheduleStore failing = new InMemoryScheduleStore() {
            @Override
            public synchronized java.util.List<Schedule> listDue(Instant dueBefore) {
                throw new IllegalStateException("store unavailable");
            }
        };
        PollLoop broken = new PollLoop(failing, new ClaimCoordinator(failing, history, DUE_BUFFER), occurrences, DIRECT,
                new Semaphore(1), DUE_BUFFER);

        assertThrows(IllegalStateException.class, () -> broken.pollOnce(T0));
    }
}
