package io.runcoord.config;

import io.runcoord.core.CoordinatorSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration of the schedule coordinator.
 */
@ConfigurationProperties(prefix = "runcoord")
public class CoordinatorProperties {
    private boolean enabled = true;
    private Duration pollEvery = Duration.ofSeconds(60);
    private Duration dueBuffer = Duration.ofSeconds(30);
    private Duration recoveryEvery = Duration.ofSeconds(60);
    // must exceed dispatchTimeout plus the longest retry backoff
    private Duration recoveryTimeout = Duration.ofMinutes(5);
    private int maxConcurrency = 10; // per instance, retries included
    private Duration dispatchTimeout = Duration.ofSeconds(60);
    private Duration tokenRefreshBuffer = Duration.ofMinutes(15);
    private int repeatedRecoveryThreshold = 3;
    private String workerId;
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getPollEvery() {
        return pollEvery;
    }

    public void setPollEvery(Duration pollEvery) {
        this.pollEvery = pollEvery;
    }

    public Duration getDueBuffer() {
        return dueBuffer;
    }

    public void setDueBuffer(Duration dueBuffer) {
        this.dueBuffer = dueBuffer;
    }

    public Duration getRecoveryEvery() {
        return recoveryEvery;
    }

    public void setRecoveryEvery(Duration recoveryEvery) {
        this.recoveryEvery = recoveryEvery;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    public void setRecoveryTimeout(Duration recoveryTimeout) {
        this.recoveryTimeout = recoveryTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getDispatchTimeout() {
        return dispatchTimeout;
    }

    public void setDispatchTimeout(Duration dispatchTimeout) {
        this.dispatchTimeout = dispatchTimeout;
    }

    public Duration getTokenRefreshBuffer() {
        return tokenRefreshBuffer;
    }

    public void setTokenRefreshBuffer(Duration tokenRefreshBuffer) {
        this.tokenRefreshBuffer = tokenRefreshBuffer;
    }

    public int getRepeatedRecoveryThreshold() {
        return repeatedRecoveryThreshold;
    }

    public void setRepeatedRecoveryThreshold(int repeatedRecoveryThreshold) {
        this.repeatedRecoveryThreshold = repeatedRecoveryThreshold;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    /**
     * Validated settings for the core runtime.
     *
     * @param resolvedWorkerId worker id to use when none is configured
     */
    public CoordinatorSettings toSettings(String resolvedWorkerId) {
        return new CoordinatorSettings(
                pollEvery,
                dueBuffer,
                recoveryEvery,
                recoveryTimeout,
                maxConcurrency,
                dispatchTimeout,
                repeatedRecoveryThreshold,
                workerId != null && !workerId.isBlank() ? workerId : resolvedWorkerId
        );
    }
}
