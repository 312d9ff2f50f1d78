package io.schedule4j.config;

import io.schedule4j.internal.mongo.ScheduledJobDocument;
import io.schedule4j.internal.mongo.ScheduledJobRunDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for schedule4j.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code schedule4j.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Collection {@code scheduled_jobs}</h3>
 * <ul>
 *   <li><b>idx_due_scan</b>: { enabled: 1, nextRunAfter: 1 }
 *       <br/>Used by the due-scan of every tick.</li>
 * </ul>
 *
 * <h3>Collection {@code scheduled_job_runs}</h3>
 * <ul>
 *   <li><b>idx_runs_task_started</b>: { taskId: 1, startedAt: -1 }
 *       <br/>Used by run history listing, newest first.</li>
 *   <li><b>idx_runs_started</b>: { startedAt: -1 }
 *       <br/>Used by hourly analytics over a time window.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_jobs.createIndex({ enabled: 1, nextRunAfter: 1 }, { name: "idx_due_scan" });
 * db.scheduled_job_runs.createIndex({ taskId: 1, startedAt: -1 }, { name: "idx_runs_task_started" });
 * db.scheduled_job_runs.createIndex({ startedAt: -1 }, { name: "idx_runs_started" });
 * </pre>
 */
public class Schedule4jMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(Schedule4jMongoIndexConfig.class);

    public static final String IDX_DUE_SCAN = "idx_due_scan";
    public static final String IDX_RUNS_TASK_STARTED = "idx_runs_task_started";
    public static final String IDX_RUNS_STARTED = "idx_runs_started";

    private final MongoTemplate mongoTemplate;

    public Schedule4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create the indexes above. Idempotent; safe to call on every startup.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduledJobDocument.class).ensureIndex(dueScanIndex());
        mongoTemplate.indexOps(ScheduledJobRunDocument.class).ensureIndex(runsByTaskIndex());
        mongoTemplate.indexOps(ScheduledJobRunDocument.class).ensureIndex(runsByStartIndex());
        log.info("schedule4j indexes ensured: {}, {}, {}", IDX_DUE_SCAN, IDX_RUNS_TASK_STARTED, IDX_RUNS_STARTED);
    }

    /**
     * Keys: enabled ASC, nextRunAfter ASC
     */
    public static Index dueScanIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("nextRunAfter", Sort.Direction.ASC)
                .named(IDX_DUE_SCAN);
    }

    /**
     * Keys: taskId ASC, startedAt DESC
     */
    public static Index runsByTaskIndex() {
        return new Index()
                .on("taskId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_RUNS_TASK_STARTED);
    }

    public static Index runsByStartIndex() {
        return new Index()
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_RUNS_STARTED);
    }
}
