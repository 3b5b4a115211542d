package io.runcoord.config;

import io.runcoord.core.CoordinatorSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinatorPropertiesTest {

    @Test
    void defaultsShouldMatchTheDocumentedValues() {
        CoordinatorSettings settings = new CoordinatorProperties().toSettings("host-1-abc");

        assertThat(settings.pollEvery()).isEqualTo(Duration.ofSeconds(60));
        assertThat(settings.dueBuffer()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.recoveryTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(settings.maxConcurrency()).isEqualTo(10);
        assertThat(settings.dispatchTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(settings.repeatedRecoveryThreshold()).isEqualTo(3);
        assertThat(settings.workerId()).isEqualTo("host-1-abc");
    }

    @Test
    void configuredWorkerIdShouldWin() {
        CoordinatorProperties props = new CoordinatorProperties();
        props.setWorkerId("worker-7");

        assertThat(props.toSettings("host-1-abc").workerId()).isEqualTo("worker-7");
    }

    @Test
    void invalidValuesShouldBeRejected() {
        CoordinatorProperties props = new CoordinatorProperties();
        props.setMaxConcurrency(0);

        assertThatThrownBy(() -> props.toSettings("w"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxConcurrency");
    }
}
