package io.schedule4j.internal.mongo;

import io.schedule4j.core.HourlyRunStats;
import io.schedule4j.core.JobRun;
import io.schedule4j.core.RunStatus;
import io.schedule4j.core.TriggerType;
import io.schedule4j.spi.RunHistory;
import io.schedule4j.spi.RunRecorder;
import io.schedule4j.spi.RunRecordingException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Run history kept in the {@code scheduled_job_runs} collection.
 *
 * <p>Writes fail with the checked {@link RunRecordingException}; the scheduler logs and drops those.
 */
public class MongoRunRecorder implements RunRecorder, RunHistory {

    private final MongoTemplate mongoTemplate;

    public MongoRunRecorder(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void record(JobRun run) throws RunRecordingException {
        Objects.requireNonNull(run, "run must not be null");
        try {
            mongoTemplate.insert(toDocument(run));
        } catch (DataAccessException e) {
            throw new RunRecordingException("failed to record run for taskId=" + run.taskId(), e);
        }
    }

    @Override
    public List<JobRun> listRuns(String taskId, int limit) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Query q = new Query(Criteria.where("taskId").is(taskId))
                .with(Sort.by(Sort.Order.desc("startedAt")))
                .limit(RunHistory.clampLimit(limit));

        List<ScheduledJobRunDocument> docs = mongoTemplate.find(q, ScheduledJobRunDocument.class);
        List<JobRun> runs = new ArrayList<>(docs.size());
        for (ScheduledJobRunDocument d : docs) {
            runs.add(toRun(d));
        }
        return runs;
    }

    @Override
    public HourlyRunStats hourlyAnalytics(int windowHours, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        int window = HourlyRunStats.clampWindow(windowHours);
        Instant since = HourlyRunStats.windowStart(window, now);

        Query q = new Query(Criteria.where("startedAt").gte(since));
        q.fields().include("status").include("startedAt").include("taskId");

        List<ScheduledJobRunDocument> docs = mongoTemplate.find(q, ScheduledJobRunDocument.class);
        List<JobRun> runs = new ArrayList<>(docs.size());
        for (ScheduledJobRunDocument d : docs) {
            runs.add(toRun(d));
        }
        return HourlyRunStats.of(runs, window, now);
    }

    static ScheduledJobRunDocument toDocument(JobRun run) {
        ScheduledJobRunDocument doc = new ScheduledJobRunDocument();
        doc.setTaskId(run.taskId());
        doc.setStatus(run.status() == null ? null : run.status().value());
        doc.setTriggerType(run.triggerType() == null ? null : run.triggerType().value());
        doc.setStartedAt(run.startedAt());
        doc.setFinishedAt(run.finishedAt());
        doc.setDurationMs(run.durationMs());
        doc.setSummary(run.summary());
        doc.setErrorMessage(run.errorMessage());
        doc.setDetails(run.details());
        return doc;
    }

    static JobRun toRun(ScheduledJobRunDocument doc) {
        return new JobRun(
                doc.getTaskId(),
                RunStatus.fromValue(doc.getStatus()).orElse(null),
                TriggerType.fromValue(doc.getTriggerType()),
                doc.getStartedAt(),
                doc.getFinishedAt(),
                doc.getDurationMs(),
                doc.getSummary(),
                doc.getErrorMessage(),
                doc.getDetails()
        );
    }
}
