package io.runcoord.internal;

import io.runcoord.CredentialProvider;
import io.runcoord.ExecutionApi;
import io.runcoord.RunHistory;
import io.runcoord.ScheduleStore;
import io.runcoord.core.ExecutionHandle;
import io.runcoord.core.ExecutionRequest;
import io.runcoord.core.FailureKind;
import io.runcoord.core.ReportWindow;
import io.runcoord.core.RunStatus;
import io.runcoord.core.RunTrigger;
import io.runcoord.core.Schedule;
import io.runcoord.core.ScheduleRun;
import io.runcoord.core.Token;
import io.runcoord.utils.WindowCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * "Run now" for a schedule, outside of its cron cadence.
 *
 * <p>Uses the same window and request construction as scheduled runs but never claims: the
 * schedule's {@code status}, {@code lastRunAt} and {@code nextRunAt} are not read for locking and
 * not written. The run is recorded as {@link RunTrigger#MANUAL}, which the claim guard ignores, and is
 * dispatched exactly once.
 */
public class ManualRunTrigger {
    private static final Logger log = LoggerFactory.getLogger(ManualRunTrigger.class);

    private final ScheduleStore store;
    private final RunHistory history;
    private final CredentialProvider credentials;
    private final ExecutionApi api;
    private final ExecutionRequestFactory requestFactory;
    private final Clock clock;

    public ManualRunTrigger(
            ScheduleStore store,
            RunHistory history,
            CredentialProvider credentials,
            ExecutionApi api,
            ExecutionRequestFactory requestFactory,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.requestFactory = Objects.requireNonNull(requestFactory, "requestFactory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ExecutionHandle trigger(String scheduleId) {
        return trigger(scheduleId, Map.of());
    }

    /**
     * Dispatches the schedule's query once with the current window.
     *
     * @param overrides parameters layered over the schedule defaults; window dates always win
     * @throws IllegalArgumentException if the schedule does not exist or is misconfigured
     * @throws io.runcoord.core.CredentialRefreshException if no valid credential can be produced
     * @throws io.runcoord.core.ExecutionApiException if the execution API rejects the request
     */
    public ExecutionHandle trigger(String scheduleId, Map<String, Object> overrides) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");

        Schedule schedule = store.findById(scheduleId)
                .orElseThrow(() -> new IllegalArgumentException("schedule not found: " + scheduleId));

        Instant now = clock.instant();
        ReportWindow window = WindowCalculator.computeWindow(schedule, now);
        ScheduleRun run = history.begin(schedule.id(), RunTrigger.MANUAL, now, now, window);

        log.info("runcoord manual run scheduleId={} runId={} window={}", schedule.id(), run.runId(), window);

        ExecutionHandle handle;
        try {
            Token token = credentials.getValidToken(schedule.userId());
            ExecutionRequest request = requestFactory.build(
                    schedule, window, token, RunTrigger.MANUAL, run.runId(), 1, overrides);
            handle = api.dispatch(request);
            if (handle == null) {
                throw new IllegalStateException("execution API returned no handle");
            }
        } catch (RuntimeException e) {
            FailureKind kind = ExecutionDispatcher.classify(e);
            log.warn("runcoord manual run failed scheduleId={} runId={} kind={} msg={}",
                    schedule.id(), run.runId(), kind, e.getMessage());
            history.complete(run.runId(), RunStatus.FAILED, 1, kind.summary(), clock.instant());
            throw e;
        }

        history.attachHandle(run.runId(), handle, 1);
        history.complete(run.runId(), RunStatus.COMPLETED, 1, null, clock.instant());
        log.info("runcoord manual run dispatched scheduleId={} runId={} handle={}", schedule.id(), run.runId(), handle);
        return handle;
    }
}
