package io.runcoord.internal;

import io.runcoord.core.ExecutionRequest;
import io.runcoord.core.ReportWindow;
import io.runcoord.core.RunTrigger;
import io.runcoord.core.Schedule;
import io.runcoord.core.Token;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionRequestFactoryTest {

    private final ExecutionRequestFactory factory = new ExecutionRequestFactory();
    private final Token token = new Token("access", "refresh", null);
    private final ReportWindow window = new ReportWindow(
            Instant.parse("2025-07-26T09:00:00Z"),
            Instant.parse("2025-08-25T09:00:00Z"));

    private Schedule schedule() {
        return Schedule.builder("s-1")
                .userId("user-1")
                .instanceId("instance-1")
                .queryId("query-1")
                .defaultParameters(Map.of("country", "US", "startDate", "stale"))
                .cronExpression("0 9 * * 1")
                .build();
    }

    @Test
    void windowDatesShouldOverrideDefaultsAndOverrides() {
        ExecutionRequest request = factory.build(schedule(), window, token, RunTrigger.SCHEDULED, "run-7", 2,
                Map.of("country", "CA", "endDate", "ignored"));

        assertThat(request.parameters())
                .containsEntry("country", "CA")
                .containsEntry("startDate", "2025-07-26T09:00:00")
                .containsEntry("endDate", "2025-08-25T09:00:00")
                .containsEntry("_schedule_id", "s-1")
                .containsEntry("_triggered_by", "scheduled")
                .containsEntry("_attempt_number", 2)
                .containsEntry("_schedule_run_id", "run-7");
        assertThat(request.instanceId()).isEqualTo("instance-1");
        assertThat(request.trigger()).isEqualTo(RunTrigger.SCHEDULED);
    }

    @Test
    void manualRunsShouldBeTaggedAsManual() {
        ExecutionRequest request = factory.build(schedule(), window, token, RunTrigger.MANUAL, null, 1, null);

        assertThat(request.parameters())
                .containsEntry("_triggered_by", "manual")
                .doesNotContainKey("_schedule_run_id");
    }

    @Test
    void missingInstanceOrQueryShouldBeRejected() {
        Schedule noInstance = schedule().toBuilder().instanceId(" ").build();
        Schedule noQuery = schedule().toBuilder().queryId(null).query(null).build();

        assertThatThrownBy(() -> factory.build(noInstance, window, token, RunTrigger.SCHEDULED, null, 1, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("instance");
        assertThatThrownBy(() -> factory.build(noQuery, window, token, RunTrigger.SCHEDULED, null, 1, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
