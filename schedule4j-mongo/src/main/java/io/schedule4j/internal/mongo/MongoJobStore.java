package io.schedule4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.schedule4j.core.JobCommit;
import io.schedule4j.core.JobFilter;
import io.schedule4j.core.JobStoreException;
import io.schedule4j.core.RunStatus;
import io.schedule4j.core.Schedule;
import io.schedule4j.core.ScheduleType;
import io.schedule4j.core.ScheduleUpdate;
import io.schedule4j.core.ScheduledJob;
import io.schedule4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for scheduled jobs.
 *
 * <p>The lease and the final commit are each a single {@code updateFirst} whose filter carries the
 * precondition, so the document-level atomicity of MongoDB is what provides mutual exclusion:
 * <ul>
 *   <li>lease: {@code {_id, enabled: true, $or: [{lockUntil: null}, {lockUntil: {$lte: now}}]}}</li>
 *   <li>commit: {@code $unset lockUntil}, {@code $set} last-run fields and {@code nextRunAfter},
 *       {@code $inc} counters</li>
 * </ul>
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<ScheduledJob> selectDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Query q = new Query(
                Criteria.where("enabled").is(true)
                        .orOperator(
                                Criteria.where("nextRunAfter").is(null),
                                Criteria.where("nextRunAfter").lte(now)
                        )
        );
        q.with(Sort.by(Sort.Order.asc("nextRunAfter")));

        List<ScheduledJobDocument> docs = execute("selectDue", () -> mongoTemplate.find(q, ScheduledJobDocument.class));
        List<ScheduledJob> due = new ArrayList<>(docs.size());
        for (ScheduledJobDocument d : docs) {
            due.add(toJob(d));
        }
        return due;
    }

    @Override
    public boolean tryAcquireLease(String taskId, Instant now, Instant lockUntil) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lockUntil, "lockUntil must not be null");

        Query q = new Query(
                Criteria.where("_id").is(taskId)
                        .and("enabled").is(true)
                        .orOperator(
                                Criteria.where("lockUntil").is(null),
                                Criteria.where("lockUntil").lte(now)
                        )
        );
        Update u = new Update().set("lockUntil", lockUntil);

        UpdateResult r = execute("tryAcquireLease", () -> mongoTemplate.updateFirst(q, u, ScheduledJobDocument.class));
        return r.getMatchedCount() > 0;
    }

    @Override
    public boolean commit(String taskId, JobCommit commit) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(commit, "commit must not be null");
        ScheduleUpdate update = commit.update();

        Update u = new Update()
                .unset("lockUntil")
                .set("lastRunStatus", commit.status().value())
                .set("lastRunStartedAt", commit.startedAt())
                .set("lastRunFinishedAt", commit.finishedAt())
                .set("updatedAt", commit.finishedAt())
                .inc("runCount", update.runCountDelta())
                .inc("failureCount", update.failureCountDelta());

        if (update.nextRunAfter() != null) {
            u.set("nextRunAfter", update.nextRunAfter());
        } else {
            u.unset("nextRunAfter");
        }
        // Only ever switched off here; re-enabling is an administrative decision.
        if (!update.enabled()) {
            u.set("enabled", false);
        }

        Query q = new Query(Criteria.where("_id").is(taskId));
        UpdateResult r = execute("commit", () -> mongoTemplate.updateFirst(q, u, ScheduledJobDocument.class));
        return r.getMatchedCount() > 0;
    }

    @Override
    public boolean recordManualRun(String taskId, RunStatus status, Instant startedAt, Instant finishedAt) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(status, "status must not be null");

        Update u = new Update()
                .set("lastRunStatus", status.value())
                .set("lastRunStartedAt", startedAt)
                .set("lastRunFinishedAt", finishedAt)
                .set("updatedAt", finishedAt)
                .inc("runCount", status.isAttempt() ? 1 : 0)
                .inc("failureCount", status == RunStatus.FAILURE ? 1 : 0);

        Query q = new Query(Criteria.where("_id").is(taskId));
        UpdateResult r = execute("recordManualRun", () -> mongoTemplate.updateFirst(q, u, ScheduledJobDocument.class));
        return r.getMatchedCount() > 0;
    }

    @Override
    public Optional<ScheduledJob> findById(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        ScheduledJobDocument doc = execute("findById", () -> mongoTemplate.findById(taskId, ScheduledJobDocument.class));
        return Optional.ofNullable(doc).map(MongoJobStore::toJob);
    }

    @Override
    public List<ScheduledJob> find(JobFilter filter) {
        Criteria c = new Criteria();
        if (filter != null) {
            if (filter.enabled() != null) {
                c = c.and("enabled").is(filter.enabled());
            }
            if (filter.handlerId() != null && !filter.handlerId().isBlank()) {
                c = c.and("handlerId").is(filter.handlerId());
            }
        }
        Query q = new Query(c).with(Sort.by(Sort.Order.asc("_id")));

        List<ScheduledJobDocument> docs = execute("find", () -> mongoTemplate.find(q, ScheduledJobDocument.class));
        List<ScheduledJob> jobs = new ArrayList<>(docs.size());
        for (ScheduledJobDocument d : docs) {
            jobs.add(toJob(d));
        }
        return jobs;
    }

    @Override
    public boolean insert(ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");
        try {
            mongoTemplate.insert(toDocument(job));
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("scheduled job insert rejected, task id taken taskId={}", job.taskId());
            return false;
        } catch (DataAccessException e) {
            throw new JobStoreException("insert failed for taskId=" + job.taskId(), e);
        }
    }

    @Override
    public boolean updateDefinition(ScheduledJob job, boolean resetNextRun) {
        Objects.requireNonNull(job, "job must not be null");

        Update u = new Update()
                .set("name", job.name())
                .set("description", job.description())
                .set("enabled", job.enabled())
                .set("configJson", job.configJson())
                .set("updatedAt", job.updatedAt());
        applySchedule(u, job.schedule());
        if (resetNextRun) {
            u.set("nextRunAfter", job.nextRunAfter());
        }

        Query q = new Query(Criteria.where("_id").is(job.taskId()));
        UpdateResult r = execute("updateDefinition", () -> mongoTemplate.updateFirst(q, u, ScheduledJobDocument.class));
        return r.getMatchedCount() > 0;
    }

    @Override
    public boolean delete(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Query q = new Query(Criteria.where("_id").is(taskId));
        return execute("delete", () -> mongoTemplate.remove(q, ScheduledJobDocument.class)).getDeletedCount() > 0;
    }

    private static void applySchedule(Update u, Schedule schedule) {
        if (schedule instanceof Schedule.Interval interval) {
            u.set("scheduleType", ScheduleType.INTERVAL.value());
            u.set("intervalSec", interval.seconds());
            u.unset("cronExpression");
        } else if (schedule instanceof Schedule.Cron cron) {
            u.set("scheduleType", ScheduleType.CRON.value());
            u.set("cronExpression", cron.expression());
            u.unset("intervalSec");
        }
    }

    private static <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new JobStoreException("mongo " + operation + " failed: " + e.getMessage(), e);
        }
    }

    static ScheduledJobDocument toDocument(ScheduledJob job) {
        ScheduledJobDocument doc = new ScheduledJobDocument();
        doc.setId(job.taskId());
        doc.setHandlerId(job.handlerId());
        doc.setName(job.name());
        doc.setDescription(job.description());
        doc.setEnabled(job.enabled());

        Schedule schedule = job.schedule();
        if (schedule instanceof Schedule.Interval interval) {
            doc.setScheduleType(ScheduleType.INTERVAL.value());
            doc.setIntervalSec(interval.seconds());
        } else if (schedule instanceof Schedule.Cron cron) {
            doc.setScheduleType(ScheduleType.CRON.value());
            doc.setCronExpression(cron.expression());
        }

        doc.setNextRunAfter(job.nextRunAfter());
        doc.setLockUntil(job.lockUntil());
        doc.setRunCount(job.runCount());
        doc.setFailureCount(job.failureCount());
        doc.setLastRunStatus(job.lastRunStatus() == null ? null : job.lastRunStatus().value());
        doc.setLastRunStartedAt(job.lastRunStartedAt());
        doc.setLastRunFinishedAt(job.lastRunFinishedAt());
        doc.setConfigJson(job.configJson());
        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(ScheduledJob)}.
     *
     * <p>An unrecognised {@code scheduleType} maps to a null schedule, which the scheduler treats as a
     * configuration error.
     */
    static ScheduledJob toJob(ScheduledJobDocument doc) {
        return ScheduledJob.builder(doc.getId())
                .handlerId(doc.getHandlerId())
                .name(doc.getName())
                .description(doc.getDescription())
                .enabled(doc.isEnabled())
                .schedule(toSchedule(doc))
                .nextRunAfter(doc.getNextRunAfter())
                .lockUntil(doc.getLockUntil())
                .runCount(doc.getRunCount())
                .failureCount(doc.getFailureCount())
                .lastRunStatus(RunStatus.fromValue(doc.getLastRunStatus()).orElse(null))
                .lastRunStartedAt(doc.getLastRunStartedAt())
                .lastRunFinishedAt(doc.getLastRunFinishedAt())
                .configJson(doc.getConfigJson())
                .createdAt(doc.getCreatedAt())
                .updatedAt(doc.getUpdatedAt())
                .build();
    }

    private static Schedule toSchedule(ScheduledJobDocument doc) {
        Optional<ScheduleType> type = ScheduleType.fromValue(doc.getScheduleType());
        if (type.isEmpty()) {
            return null;
        }
        return switch (type.get()) {
            case INTERVAL -> Schedule.interval(doc.getIntervalSec() == null ? 0L : doc.getIntervalSec());
            case CRON -> Schedule.cron(doc.getCronExpression());
        };
    }
}
