package io.runcoord.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.runcoord.ScheduleStore;
import io.runcoord.core.OccurrenceOutcome;
import io.runcoord.core.Schedule;
import io.runcoord.core.ScheduleStatus;
import io.runcoord.core.WindowConfig;
import io.runcoord.core.WindowMode;
import io.runcoord.utils.CronSchedules;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence of schedules.
 *
 * <p>Every runtime transition is one {@code updateFirst} whose filter carries the expected
 * {@code lastRunAt} and status, so MongoDB's single-document atomicity provides the compare-and-swap.
 * {@code claimedBy} is informational only; ownership is decided by the claim timestamp.
 * {@code claimRenewedAt} is the claim heartbeat that recovery keys on.
 */
public class MongoScheduleStore implements ScheduleStore {

    // a row written without a status is treated as IDLE
    private static final List<Object> CLAIMABLE = Arrays.asList(
            ScheduleStatus.IDLE.name(),
            ScheduleStatus.SUCCEEDED.name(),
            ScheduleStatus.FAILED.name(),
            null
    );

    private static final List<Object> LIVE = List.of(
            ScheduleStatus.CLAIMED.name(),
            ScheduleStatus.EXECUTING.name()
    );

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final String workerId;

    public MongoScheduleStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, String workerId) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        this.workerId = workerId;
    }

    /**
     * Inserts or replaces the configuration of a schedule. Runtime fields are written only on insert.
     *
     * @throws IllegalArgumentException if the cron expression or timezone cannot be evaluated
     */
    public void save(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        if (schedule.cronExpression() != null) {
            CronSchedules.validate(schedule.cronExpression(), schedule.timezone());
        }

        Query q = new Query(Criteria.where("_id").is(schedule.id()));
        Update u = new Update()
                .set("userId", schedule.userId())
                .set("instanceId", schedule.instanceId())
                .set("queryId", schedule.queryId())
                .set("query", schedule.query())
                .set("defaultParameters", toMap(schedule.defaultParameters()))
                .set("cronExpression", schedule.cronExpression())
                .set("timezone", schedule.timezone())
                .set("windowMode", schedule.window().mode())
                .set("windowSizeDays", schedule.window().windowSizeDays())
                .set("lookbackDays", schedule.window().lookbackDays())
                .set("reportingLagDays", schedule.window().reportingLagDays())
                .set("maxAttempts", schedule.maxAttempts())
                .set("active", schedule.active())
                .set("notifyOnFailure", schedule.notifyOnFailure())
                .set("autoPauseOnFailure", schedule.autoPauseOnFailure())
                .set("failureThreshold", schedule.failureThreshold())
                .setOnInsert("nextRunAt", schedule.nextRunAt())
                .setOnInsert("lastRunAt", schedule.lastRunAt())
                .setOnInsert("status", schedule.status())
                .setOnInsert("attemptCount", schedule.attemptCount())
                .setOnInsert("recoveryCount", schedule.recoveryCount())
                .setOnInsert("executionCount", schedule.executionCount())
                .setOnInsert("successCount", schedule.successCount())
                .setOnInsert("failureCount", schedule.failureCount())
                .setOnInsert("consecutiveFailures", schedule.consecutiveFailures())
                .setOnInsert("runSequence", 0L);

        mongoTemplate.upsert(q, u, ScheduleDocument.class);
    }

    /**
     * Deactivates a schedule. The row and its history are kept.
     *
     * @return true if the schedule exists
     */
    public boolean deactivate(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Query q = new Query(Criteria.where("_id").is(scheduleId));
        return mongoTemplate.updateFirst(q, new Update().set("active", false), ScheduleDocument.class)
                .getMatchedCount() > 0;
    }

    @Override
    public List<Schedule> listDue(Instant dueBefore) {
        Objects.requireNonNull(dueBefore, "dueBefore must not be null");

        Query q = new Query(
                Criteria.where("nextRunAt").ne(null).lte(dueBefore)
                        .and("active").ne(false)
                        .and("status").in(CLAIMABLE)
        );
        q.with(Sort.by(Sort.Order.asc("nextRunAt")));

        return toSchedules(mongoTemplate.find(q, ScheduleDocument.class));
    }

    @Override
    public Optional<Schedule> findById(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        ScheduleDocument doc = mongoTemplate.findById(scheduleId, ScheduleDocument.class);
        return Optional.ofNullable(doc).map(this::toSchedule);
    }

    @Override
    public boolean tryClaim(String scheduleId, Instant expectedLastRunAt, Instant claimedAt, Instant newNextRunAt) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(claimedAt, "claimedAt must not be null");

        Query q = new Query(
                Criteria.where("_id").is(scheduleId)
                        .and("lastRunAt").is(expectedLastRunAt)
                        .and("active").ne(false)
                        .and("status").in(CLAIMABLE)
        );

        Update u = new Update()
                .set("status", ScheduleStatus.CLAIMED)
                .set("lastRunAt", claimedAt)
                .set("claimRenewedAt", claimedAt)
                .set("nextRunAt", newNextRunAt)
                .set("attemptCount", 0)
                .set("claimedBy", workerId);

        return mongoTemplate.updateFirst(q, u, ScheduleDocument.class).getModifiedCount() == 1;
    }

    @Override
    public boolean markExecuting(String scheduleId, Instant claimedAt, int attempt, Instant renewedAt) {
        Objects.requireNonNull(renewedAt, "renewedAt must not be null");
        Update u = new Update()
                .set("status", ScheduleStatus.EXECUTING)
                .set("attemptCount", attempt)
                .set("claimRenewedAt", renewedAt);

        return updateLiveClaim(scheduleId, claimedAt, u).getMatchedCount() == 1;
    }

    @Override
    public boolean recordOutcome(String scheduleId, Instant claimedAt, OccurrenceOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");

        Update u = new Update()
                .set("status", outcome.status())
                .set("attemptCount", outcome.attempts())
                .set("lastFinishedAt", outcome.finishedAt())
                .set("recoveryCount", 0)
                .inc("executionCount", 1)
                .unset("claimedBy")
                .unset("claimRenewedAt");

        if (outcome.succeeded()) {
            u.inc("successCount", 1)
                    .set("consecutiveFailures", 0)
                    .unset("lastFailureKind")
                    .unset("lastFailureSummary");
        } else {
            u.inc("failureCount", 1)
                    .inc("consecutiveFailures", 1)
                    .set("lastFailureKind", outcome.failureKind())
                    .set("lastFailureSummary", outcome.summary());
        }

        if (outcome.handle() != null) {
            u.set("lastExecutionHandle", outcome.handle().id());
        }

        Query q = liveClaim(scheduleId, claimedAt);
        if (!outcome.succeeded()) {
            // only the claimant writes the counters, so the read stays valid until the guarded write
            ScheduleDocument current = mongoTemplate.findOne(q, ScheduleDocument.class);
            if (current == null) {
                return false;
            }
            if (current.isAutoPauseOnFailure()
                    && current.getConsecutiveFailures() + 1 >= failureThreshold(current)) {
                u.set("active", false);
            }
        }

        return mongoTemplate.updateFirst(q, u, ScheduleDocument.class).getMatchedCount() == 1;
    }

    @Override
    public List<Schedule> findStuck(Instant renewedBefore) {
        Objects.requireNonNull(renewedBefore, "renewedBefore must not be null");

        Query q = new Query(
                Criteria.where("status").in(LIVE)
                        .andOperator(heartbeatBefore(renewedBefore))
        );
        q.with(Sort.by(Sort.Order.asc("lastRunAt")));

        return toSchedules(mongoTemplate.find(q, ScheduleDocument.class));
    }

    @Override
    public boolean tryRecover(String scheduleId, Instant claimedAt, Instant renewedBefore, Instant nextRunAtOrNull) {
        Objects.requireNonNull(renewedBefore, "renewedBefore must not be null");
        Update u = new Update()
                .set("status", ScheduleStatus.IDLE)
                .inc("recoveryCount", 1)
                .unset("claimedBy")
                .unset("claimRenewedAt");

        if (nextRunAtOrNull != null) {
            u.set("nextRunAt", nextRunAtOrNull);
        }

        Query q = liveClaim(scheduleId, claimedAt);
        // the executor may have renewed the heartbeat since the scan
        q.addCriteria(heartbeatBefore(renewedBefore));
        return mongoTemplate.updateFirst(q, u, ScheduleDocument.class).getModifiedCount() == 1;
    }

    @Override
    public boolean advanceNextRunAt(String scheduleId, Instant expectedNextRunAt, Instant newNextRunAt) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(newNextRunAt, "newNextRunAt must not be null");

        Query q = new Query(
                Criteria.where("_id").is(scheduleId)
                        .and("nextRunAt").is(expectedNextRunAt)
                        .and("status").in(CLAIMABLE)
        );
        return mongoTemplate.updateFirst(q, new Update().set("nextRunAt", newNextRunAt), ScheduleDocument.class)
                .getModifiedCount() == 1;
    }

    private UpdateResult updateLiveClaim(String scheduleId, Instant claimedAt, Update update) {
        return mongoTemplate.updateFirst(liveClaim(scheduleId, claimedAt), update, ScheduleDocument.class);
    }

    private static Query liveClaim(String scheduleId, Instant claimedAt) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(claimedAt, "claimedAt must not be null");

        return new Query(
                Criteria.where("_id").is(scheduleId)
                        // a newer claim has replaced lastRunAt; never write back over it
                        .and("lastRunAt").is(claimedAt)
                        .and("status").in(LIVE)
        );
    }

    // claims written without a heartbeat fall back to the claim time
    private static Criteria heartbeatBefore(Instant renewedBefore) {
        return new Criteria().orOperator(
                Criteria.where("claimRenewedAt").lt(renewedBefore),
                new Criteria().andOperator(
                        Criteria.where("claimRenewedAt").exists(false),
                        Criteria.where("lastRunAt").lt(renewedBefore)
                )
        );
    }

    private static int failureThreshold(ScheduleDocument doc) {
        Integer threshold = doc.getFailureThreshold();
        return threshold == null || threshold <= 0 ? Schedule.DEFAULT_FAILURE_THRESHOLD : threshold;
    }

    private List<Schedule> toSchedules(List<ScheduleDocument> docs) {
        List<Schedule> out = new ArrayList<>(docs.size());
        for (ScheduleDocument doc : docs) {
            out.add(toSchedule(doc));
        }
        return out;
    }

    Schedule toSchedule(ScheduleDocument doc) {
        int lookback = doc.getLookbackDays() == null ? 0 : doc.getLookbackDays();
        int windowSize = doc.getWindowSizeDays() == null ? 0 : doc.getWindowSizeDays();
        WindowMode mode = doc.getWindowMode() != null
                ? doc.getWindowMode()
                : (lookback > 0 ? WindowMode.FIXED : WindowMode.ROLLING);

        // only the span of the resolved mode is defaulted
        if (mode == WindowMode.ROLLING && windowSize <= 0) {
            windowSize = WindowConfig.DEFAULT_SPAN_DAYS;
        } else if (mode == WindowMode.FIXED && lookback <= 0) {
            lookback = WindowConfig.DEFAULT_SPAN_DAYS;
        }

        WindowConfig window = new WindowConfig(
                mode,
                windowSize,
                lookback,
                doc.getReportingLagDays() == null ? WindowConfig.DEFAULT_REPORTING_LAG_DAYS : doc.getReportingLagDays()
        );

        return Schedule.builder(doc.getId())
                .userId(doc.getUserId())
                .instanceId(doc.getInstanceId())
                .queryId(doc.getQueryId())
                .query(doc.getQuery())
                .defaultParameters(toMap(doc.getDefaultParameters()))
                .cronExpression(doc.getCronExpression())
                .timezone(doc.getTimezone())
                .nextRunAt(doc.getNextRunAt())
                .lastRunAt(doc.getLastRunAt())
                .claimRenewedAt(doc.getClaimRenewedAt())
                .window(window)
                .status(doc.getStatus())
                .attemptCount(doc.getAttemptCount())
                .maxAttempts(doc.getMaxAttempts() == null ? Schedule.DEFAULT_MAX_ATTEMPTS : doc.getMaxAttempts())
                .recoveryCount(doc.getRecoveryCount())
                .executionCount(doc.getExecutionCount())
                .successCount(doc.getSuccessCount())
                .failureCount(doc.getFailureCount())
                .consecutiveFailures(doc.getConsecutiveFailures())
                .active(doc.getActive() == null || doc.getActive())
                .notifyOnFailure(doc.isNotifyOnFailure())
                .autoPauseOnFailure(doc.isAutoPauseOnFailure())
                .failureThreshold(failureThreshold(doc))
                .build();
    }

    private Map<String, Object> toMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        // normalizes nested values to plain maps, lists and scalars
        Map<String, Object> converted = objectMapper.convertValue(raw, new TypeReference<>() {
        });
        Map<String, Object> out = new LinkedHashMap<>();
        converted.forEach((k, v) -> {
            if (k != null && v != null) {
                out.put(k, v);
            }
        });
        return out;
    }
}
