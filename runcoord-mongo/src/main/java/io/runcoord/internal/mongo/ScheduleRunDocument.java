package io.runcoord.internal.mongo;

import io.runcoord.core.RunStatus;
import io.runcoord.core.RunTrigger;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for the execution history.
 */
@Document(collection = "schedule_runs")
public class ScheduleRunDocument {

    @Id
    private String id;

    private String scheduleId;
    private long runNumber;
    private RunTrigger trigger;
    private Instant scheduledFor;
    private Instant startedAt;
    private Instant windowStart;
    private Instant windowEnd;
    private RunStatus status;
    private int attemptCount;
    private String executionHandle;
    private String failureSummary;
    private Instant completedAt;

    public ScheduleRunDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getScheduleId() {
        return scheduleId;
    }

    public void setScheduleId(String scheduleId) {
        this.scheduleId = scheduleId;
    }

    public long getRunNumber() {
        return runNumber;
    }

    public void setRunNumber(long runNumber) {
        this.runNumber = runNumber;
    }

    public RunTrigger getTrigger() {
        return trigger;
    }

    public void setTrigger(RunTrigger trigger) {
        this.trigger = trigger;
    }

    public Instant getScheduledFor() {
        return scheduledFor;
    }

    public void setScheduledFor(Instant scheduledFor) {
        this.scheduledFor = scheduledFor;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public void setWindowStart(Instant windowStart) {
        this.windowStart = windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public void setWindowEnd(Instant windowEnd) {
        this.windowEnd = windowEnd;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    public String getExecutionHandle() {
        return executionHandle;
    }

    public void setExecutionHandle(String executionHandle) {
        this.executionHandle = executionHandle;
    }

    public String getFailureSummary() {
        return failureSummary;
    }

    public void setFailureSummary(String failureSummary) {
        this.failureSummary = failureSummary;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
