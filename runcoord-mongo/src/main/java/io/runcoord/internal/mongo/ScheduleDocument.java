package io.runcoord.internal.mongo;

import io.runcoord.core.FailureKind;
import io.runcoord.core.ScheduleStatus;
import io.runcoord.core.WindowMode;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for schedules.
 *
 * <p>Fields missing on older rows are read with defaults: {@code status} as IDLE, {@code active} as
 * true, a window without span as 7 days, {@code reportingLagDays} as 14, {@code maxAttempts} and
 * {@code failureThreshold} as 3.
 */
@Document(collection = "schedules")
public class ScheduleDocument {

    @Id
    private String id;

    private String userId;
    private String instanceId;
    private String queryId;
    private String query;
    private Map<String, Object> defaultParameters;

    private String cronExpression;
    private String timezone;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    private Instant lastRunAt;
    private Instant claimRenewedAt;

    private WindowMode windowMode;
    private Integer windowSizeDays;
    private Integer lookbackDays;
    private Integer reportingLagDays;

    private ScheduleStatus status;
    private int attemptCount;
    private Integer maxAttempts;
    private int recoveryCount;

    private int executionCount;
    private int successCount;
    private int failureCount;
    private int consecutiveFailures;

    private Boolean active;
    private boolean notifyOnFailure;
    private boolean autoPauseOnFailure;
    private Integer failureThreshold;

    private String claimedBy;
    private Instant lastFinishedAt;
    private FailureKind lastFailureKind;
    private String lastFailureSummary;
    private String lastExecutionHandle;
    private long runSequence;

    public ScheduleDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Map<String, Object> getDefaultParameters() {
        return defaultParameters;
    }

    public void setDefaultParameters(Map<String, Object> defaultParameters) {
        this.defaultParameters = defaultParameters;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public WindowMode getWindowMode() {
        return windowMode;
    }

    public void setWindowMode(WindowMode windowMode) {
        this.windowMode = windowMode;
    }

    public Integer getWindowSizeDays() {
        return windowSizeDays;
    }

    public void setWindowSizeDays(Integer windowSizeDays) {
        this.windowSizeDays = windowSizeDays;
    }

    public Integer getLookbackDays() {
        return lookbackDays;
    }

    public void setLookbackDays(Integer lookbackDays) {
        this.lookbackDays = lookbackDays;
    }

    public Integer getReportingLagDays() {
        return reportingLagDays;
    }

    public void setReportingLagDays(Integer reportingLagDays) {
        this.reportingLagDays = reportingLagDays;
    }

    public ScheduleStatus getStatus() {
        return status;
    }

    public void setStatus(ScheduleStatus status) {
        this.status = status;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    public Integer getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(Integer maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getRecoveryCount() {
        return recoveryCount;
    }

    public void setRecoveryCount(int recoveryCount) {
        this.recoveryCount = recoveryCount;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public boolean isNotifyOnFailure() {
        return notifyOnFailure;
    }

    public void setNotifyOnFailure(boolean notifyOnFailure) {
        this.notifyOnFailure = notifyOnFailure;
    }

    public String getClaimedBy() {
        return claimedBy;
    }

    public void setClaimedBy(String claimedBy) {
        this.claimedBy = claimedBy;
    }

    public Instant getLastFinishedAt() {
        return lastFinishedAt;
    }

    public void setLastFinishedAt(Instant lastFinishedAt) {
        this.lastFinishedAt = lastFinishedAt;
    }

    public FailureKind getLastFailureKind() {
        return lastFailureKind;
    }

    public void setLastFailureKind(FailureKind lastFailureKind) {
        this.lastFailureKind = lastFailureKind;
    }

    public String getLastFailureSummary() {
        return lastFailureSummary;
    }

    public void setLastFailureSummary(String lastFailureSummary) {
        this.lastFailureSummary = lastFailureSummary;
    }

    public String getLastExecutionHandle() {
        return lastExecutionHandle;
    }

    public void setLastExecutionHandle(String lastExecutionHandle) {
        this.lastExecutionHandle = lastExecutionHandle;
    }

    public long getRunSequence() {
        return runSequence;
    }

    public void setRunSequence(long runSequence) {
        this.runSequence = runSequence;
    }

    public Instant getClaimRenewedAt() {
        return claimRenewedAt;
    }

    public void setClaimRenewedAt(Instant claimRenewedAt) {
        this.claimRenewedAt = claimRenewedAt;
    }

    public int getExecutionCount() {
        return executionCount;
    }

    public void setExecutionCount(int executionCount) {
        this.executionCount = executionCount;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public void setSuccessCount(int successCount) {
        this.successCount = successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public void setFailureCount(int failureCount) {
        this.failureCount = failureCount;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public boolean isAutoPauseOnFailure() {
        return autoPauseOnFailure;
    }

    public void setAutoPauseOnFailure(boolean autoPauseOnFailure) {
        this.autoPauseOnFailure = autoPauseOnFailure;
    }

    public Integer getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(Integer failureThreshold) {
        this.failureThreshold = failureThreshold;
    }
}
