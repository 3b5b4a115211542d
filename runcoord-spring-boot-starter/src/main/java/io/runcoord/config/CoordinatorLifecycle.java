package io.runcoord.config;

import io.runcoord.Coordinator;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Bridges the coordinator's start/stop lifecycle with the Spring container lifecycle.
 */
public class CoordinatorLifecycle implements SmartLifecycle {
    private final Coordinator coordinator;

    public CoordinatorLifecycle(Coordinator coordinator) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
    }

    @Override
    public void start() {
        coordinator.start();
    }

    @Override
    public void stop() {
        coordinator.stop();
    }

    @Override
    public boolean isRunning() {
        return coordinator.isRunning();
    }

    // start after everything the coordinator calls into, stop before it
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
