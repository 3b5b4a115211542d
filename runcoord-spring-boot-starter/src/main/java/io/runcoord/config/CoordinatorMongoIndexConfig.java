package io.runcoord.config;

import io.runcoord.internal.mongo.ScheduleDocument;
import io.runcoord.internal.mongo.ScheduleRunDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the coordinator.
 *
 * <p>Indexes are not created at startup unless {@code runcoord.ensure-indexes-on-startup=true}; in
 * production they are usually managed by migrations.
 *
 * <h3>Collection {@code schedules}</h3>
 * <ul>
 *   <li><b>idx_due</b>: { status: 1, nextRunAt: 1 }
 *       <br/>Used by the poll loop to list due schedules.</li>
 *   <li><b>idx_stuck</b>: { status: 1, lastRunAt: 1 }
 *       <br/>Used by the recovery monitor to find claims older than the recovery timeout.</li>
 * </ul>
 *
 * <h3>Collection {@code schedule_runs}</h3>
 * <ul>
 *   <li><b>ux_schedule_run_number</b> (unique): { scheduleId: 1, runNumber: -1 }
 *       <br/>Run history listing, newest first.</li>
 *   <li><b>idx_schedule_trigger_scheduled_for</b>: { scheduleId: 1, trigger: 1, scheduledFor: 1 }
 *       <br/>Secondary claim guard.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.schedules.createIndex({ status: 1, nextRunAt: 1 }, { name: "idx_due" });
 * db.schedules.createIndex({ status: 1, lastRunAt: 1 }, { name: "idx_stuck" });
 * db.schedule_runs.createIndex({ scheduleId: 1, runNumber: -1 }, { name: "ux_schedule_run_number", unique: true });
 * db.schedule_runs.createIndex({ scheduleId: 1, trigger: 1, scheduledFor: 1 }, { name: "idx_schedule_trigger_scheduled_for" });
 * </pre>
 */
public class CoordinatorMongoIndexConfig {

    public static final String IDX_DUE = "idx_due";
    public static final String IDX_STUCK = "idx_stuck";
    public static final String UX_SCHEDULE_RUN_NUMBER = "ux_schedule_run_number";
    public static final String IDX_SCHEDULE_TRIGGER_SCHEDULED_FOR = "idx_schedule_trigger_scheduled_for";

    private final MongoTemplate mongoTemplate;

    public CoordinatorMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(dueIndex());
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(stuckIndex());
        mongoTemplate.indexOps(ScheduleRunDocument.class).ensureIndex(runNumberIndex());
        mongoTemplate.indexOps(ScheduleRunDocument.class).ensureIndex(scheduledRunGuardIndex());
    }

    public static Index dueIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_DUE);
    }

    public static Index stuckIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("lastRunAt", Sort.Direction.ASC)
                .named(IDX_STUCK);
    }

    public static Index runNumberIndex() {
        return new Index()
                .on("scheduleId", Sort.Direction.ASC)
                .on("runNumber", Sort.Direction.DESC)
                .unique()
                .named(UX_SCHEDULE_RUN_NUMBER);
    }

    public static Index scheduledRunGuardIndex() {
        return new Index()
                .on("scheduleId", Sort.Direction.ASC)
                .on("trigger", Sort.Direction.ASC)
                .on("scheduledFor", Sort.Direction.ASC)
                .named(IDX_SCHEDULE_TRIGGER_SCHEDULED_FOR);
    }
}
