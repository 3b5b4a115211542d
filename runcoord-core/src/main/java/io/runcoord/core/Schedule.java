package io.runcoord.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a persisted schedule row.
 *
 * <p>Configuration fields (query, cron, window) are owned by the management surface; the coordinator
 * only ever changes the runtime fields (status, timestamps, attempt and recovery counters) and does so
 * through the {@code ScheduleStore} compare-and-swap operations.
 */
public record Schedule(

        // identity
        String id,
        String userId,
        String instanceId,
        String queryId,
        String query,
        Map<String, Object> defaultParameters,

        // timing
        String cronExpression,
        String timezone,
        Instant nextRunAt,
        Instant lastRunAt,
        Instant claimRenewedAt,

        // window
        WindowConfig window,

        // runtime
        ScheduleStatus status,
        int attemptCount,
        int maxAttempts,
        int recoveryCount,

        // statistics
        int executionCount,
        int successCount,
        int failureCount,
        int consecutiveFailures,

        // flags
        boolean active,
        boolean notifyOnFailure,
        boolean autoPauseOnFailure,
        int failureThreshold
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;

    public Schedule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(window, "window must not be null");
        defaultParameters = defaultParameters == null ? Map.of() : Map.copyOf(defaultParameters);
        status = status == null ? ScheduleStatus.IDLE : status;
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * True when recording one more failed occurrence pauses the schedule.
     */
    public boolean pausesOnNextFailure() {
        return autoPauseOnFailure && consecutiveFailures + 1 >= failureThreshold;
    }

    /**
     * Liveness timestamp of the current claim; claims written before heartbeats existed only carry
     * {@code lastRunAt}.
     */
    public Instant claimHeartbeat() {
        return claimRenewedAt != null ? claimRenewedAt : lastRunAt;
    }

    public Builder toBuilder() {
        return new Builder(id)
                .userId(userId)
                .instanceId(instanceId)
                .queryId(queryId)
                .query(query)
                .defaultParameters(defaultParameters)
                .cronExpression(cronExpression)
                .timezone(timezone)
                .nextRunAt(nextRunAt)
                .lastRunAt(lastRunAt)
                .claimRenewedAt(claimRenewedAt)
                .window(window)
                .status(status)
                .attemptCount(attemptCount)
                .maxAttempts(maxAttempts)
                .recoveryCount(recoveryCount)
                .executionCount(executionCount)
                .successCount(successCount)
                .failureCount(failureCount)
                .consecutiveFailures(consecutiveFailures)
                .active(active)
                .notifyOnFailure(notifyOnFailure)
                .autoPauseOnFailure(autoPauseOnFailure)
                .failureThreshold(failureThreshold);
    }

    public static final class Builder {
        private final String id;
        private String userId;
        private String instanceId;
        private String queryId;
        private String query;
        private Map<String, Object> defaultParameters = Map.of();
        private String cronExpression;
        private String timezone = "UTC";
        private Instant nextRunAt;
        private Instant lastRunAt;
        private Instant claimRenewedAt;
        private WindowConfig window = WindowConfig.rolling(7);
        private ScheduleStatus status = ScheduleStatus.IDLE;
        private int attemptCount;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private int recoveryCount;
        private int executionCount;
        private int successCount;
        private int failureCount;
        private int consecutiveFailures;
        private boolean active = true;
        private boolean notifyOnFailure;
        private boolean autoPauseOnFailure;
        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder queryId(String queryId) {
            this.queryId = queryId;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder defaultParameters(Map<String, Object> defaultParameters) {
            this.defaultParameters = defaultParameters;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder claimRenewedAt(Instant claimRenewedAt) {
            this.claimRenewedAt = claimRenewedAt;
            return this;
        }

        public Builder window(WindowConfig window) {
            this.window = window;
            return this;
        }

        public Builder status(ScheduleStatus status) {
            this.status = status;
            return this;
        }

        public Builder attemptCount(int attemptCount) {
            this.attemptCount = attemptCount;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder recoveryCount(int recoveryCount) {
            this.recoveryCount = recoveryCount;
            return this;
        }

        public Builder executionCount(int executionCount) {
            this.executionCount = executionCount;
            return this;
        }

        public Builder successCount(int successCount) {
            this.successCount = successCount;
            return this;
        }

        public Builder failureCount(int failureCount) {
            this.failureCount = failureCount;
            return this;
        }

        public Builder consecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder notifyOnFailure(boolean notifyOnFailure) {
            this.notifyOnFailure = notifyOnFailure;
            return this;
        }

        public Builder autoPauseOnFailure(boolean autoPauseOnFailure) {
            this.autoPauseOnFailure = autoPauseOnFailure;
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Schedule build() {
            return new Schedule(
                    id,
                    userId,
                    instanceId,
                    queryId,
                    query,
                    defaultParameters,
                    cronExpression,
                    timezone,
                    nextRunAt,
                    lastRunAt,
                    claimRenewedAt,
                    window,
                    status,
                    attemptCount,
                    maxAttempts,
                    recoveryCount,
                    executionCount,
                    successCount,
                    failureCount,
                    consecutiveFailures,
                    active,
                    notifyOnFailure,
                    autoPauseOnFailure,
                    failureThreshold
            );
        }
    }
}
