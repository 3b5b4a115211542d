package io.runcoord.internal;

import io.runcoord.core.ExecutionRequest;
import io.runcoord.core.ReportWindow;
import io.runcoord.core.RunTrigger;
import io.runcoord.core.Schedule;
import io.runcoord.core.Token;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds execution requests for scheduled and manual runs alike.
 *
 * <p>Parameter precedence: schedule defaults, then caller overrides, then the window dates and run
 * metadata, which callers cannot override.
 */
public class ExecutionRequestFactory {

    public static final String START_DATE = "startDate";
    public static final String END_DATE = "endDate";
    public static final String SCHEDULE_ID = "_schedule_id";
    public static final String TRIGGERED_BY = "_triggered_by";
    public static final String RUN_ID = "_schedule_run_id";
    public static final String ATTEMPT_NUMBER = "_attempt_number";

    public ExecutionRequest build(
            Schedule schedule,
            ReportWindow window,
            Token token,
            RunTrigger trigger,
            String runId,
            int attempt,
            Map<String, Object> overrides
    ) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");

        if (isBlank(schedule.instanceId())) {
            throw new IllegalArgumentException("schedule " + schedule.id() + " has no instance id");
        }
        if (isBlank(schedule.query()) && isBlank(schedule.queryId())) {
            throw new IllegalArgumentException("schedule " + schedule.id() + " has neither query text nor query id");
        }

        Map<String, Object> params = new LinkedHashMap<>(schedule.defaultParameters());
        if (overrides != null) {
            overrides.forEach((k, v) -> {
                if (k != null && v != null) {
                    params.put(k, v);
                }
            });
        }

        params.put(START_DATE, window.formattedStart());
        params.put(END_DATE, window.formattedEnd());
        params.put(SCHEDULE_ID, schedule.id());
        params.put(TRIGGERED_BY, trigger.name().toLowerCase(Locale.ROOT));
        params.put(ATTEMPT_NUMBER, attempt);
        if (runId != null) {
            params.put(RUN_ID, runId);
        }

        return new ExecutionRequest(
                schedule.instanceId(),
                schedule.queryId(),
                schedule.query(),
                token,
                window,
                params,
                trigger
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
