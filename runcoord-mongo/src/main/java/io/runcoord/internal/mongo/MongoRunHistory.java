package io.runcoord.internal.mongo;

import io.runcoord.RunHistory;
import io.runcoord.core.ExecutionHandle;
import io.runcoord.core.ReportWindow;
import io.runcoord.core.RunStatus;
import io.runcoord.core.RunTrigger;
import io.runcoord.core.ScheduleRun;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MongoDB persistence of the execution history ({@code schedule_runs}).
 *
 * <p>Run numbers come from a counter on the schedule row, incremented with {@code findAndModify}, so
 * they stay unique per schedule across coordinator instances.
 */
public class MongoRunHistory implements RunHistory {

    private final MongoTemplate mongoTemplate;

    public MongoRunHistory(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public ScheduleRun begin(String scheduleId, RunTrigger trigger, Instant scheduledFor, Instant startedAt, ReportWindow window) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(window, "window must not be null");

        ScheduleRunDocument doc = new ScheduleRunDocument();
        doc.setScheduleId(scheduleId);
        doc.setRunNumber(nextRunNumber(scheduleId));
        doc.setTrigger(trigger);
        doc.setScheduledFor(scheduledFor);
        doc.setStartedAt(startedAt);
        doc.setWindowStart(window.start());
        doc.setWindowEnd(window.end());
        doc.setStatus(RunStatus.RUNNING);
        doc.setAttemptCount(0);

        return toRun(mongoTemplate.insert(doc));
    }

    @Override
    public void attachHandle(String runId, ExecutionHandle handle, int attempt) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(handle, "handle must not be null");

        Update u = new Update()
                .set("executionHandle", handle.id())
                .set("attemptCount", attempt);
        mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(runId)), u, ScheduleRunDocument.class);
    }

    @Override
    public void complete(String runId, RunStatus status, int attempts, String failureSummary, Instant completedAt) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");

        Update u = new Update()
                .set("status", status)
                .set("attemptCount", attempts)
                .set("completedAt", completedAt);
        if (failureSummary != null) {
            u.set("failureSummary", failureSummary);
        } else {
            u.unset("failureSummary");
        }

        // a run closed by recovery stays closed
        Query q = new Query(Criteria.where("_id").is(runId).and("status").is(RunStatus.RUNNING.name()));
        mongoTemplate.updateFirst(q, u, ScheduleRunDocument.class);
    }

    @Override
    public boolean hasScheduledRunSince(String scheduleId, Instant scheduledFor) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(scheduledFor, "scheduledFor must not be null");

        Query q = new Query(
                Criteria.where("scheduleId").is(scheduleId)
                        .and("trigger").is(RunTrigger.SCHEDULED.name())
                        .and("scheduledFor").gte(scheduledFor)
        );
        return mongoTemplate.exists(q, ScheduleRunDocument.class);
    }

    @Override
    public int abandonRunning(String scheduleId, Instant startedAtOrBefore, String summary, Instant completedAt) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(startedAtOrBefore, "startedAtOrBefore must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");

        Query q = new Query(
                Criteria.where("scheduleId").is(scheduleId)
                        .and("trigger").is(RunTrigger.SCHEDULED.name())
                        .and("status").is(RunStatus.RUNNING.name())
                        .and("startedAt").lte(startedAtOrBefore)
        );
        Update u = new Update()
                .set("status", RunStatus.FAILED)
                .set("failureSummary", summary)
                .set("completedAt", completedAt);

        return (int) mongoTemplate.updateMulti(q, u, ScheduleRunDocument.class).getModifiedCount();
    }

    @Override
    public List<ScheduleRun> listRuns(String scheduleId, int limit) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }

        Query q = new Query(Criteria.where("scheduleId").is(scheduleId));
        q.with(Sort.by(Sort.Order.desc("runNumber")));
        q.limit(limit);

        List<ScheduleRunDocument> docs = mongoTemplate.find(q, ScheduleRunDocument.class);
        List<ScheduleRun> out = new ArrayList<>(docs.size());
        for (ScheduleRunDocument d : docs) {
            out.add(toRun(d));
        }
        return out;
    }

    private long nextRunNumber(String scheduleId) {
        ScheduleDocument updated = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(scheduleId)),
                new Update().inc("runSequence", 1),
                FindAndModifyOptions.options().returnNew(true),
                ScheduleDocument.class
        );
        if (updated == null) {
            throw new IllegalStateException("schedule not found: " + scheduleId);
        }
        return updated.getRunSequence();
    }

    private static ScheduleRun toRun(ScheduleRunDocument d) {
        return new ScheduleRun(
                d.getId(),
                d.getScheduleId(),
                d.getRunNumber(),
                d.getTrigger(),
                d.getScheduledFor(),
                d.getStartedAt(),
                d.getWindowStart(),
                d.getWindowEnd(),
                d.getStatus(),
                d.getAttemptCount(),
                d.getExecutionHandle(),
                d.getFailureSummary(),
                d.getCompletedAt()
        );
    }
}
