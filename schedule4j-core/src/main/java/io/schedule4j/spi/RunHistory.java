package io.schedule4j.spi;

import io.schedule4j.core.HourlyRunStats;
import io.schedule4j.core.JobRun;

import java.time.Instant;
import java.util.List;

/**
 * Read side of the run history.
 */
public interface RunHistory {

    int DEFAULT_LIMIT = 50;
    int MAX_LIMIT = 200;

    /**
     * Most recent runs of a job, newest first. {@code limit} defaults to 50 when not positive and is capped at 200.
     */
    List<JobRun> listRuns(String taskId, int limit);

    /**
     * Per-hour run counts over the last {@code windowHours} hours ending with the hour containing {@code now}.
     */
    HourlyRunStats hourlyAnalytics(int windowHours, Instant now);

    static int clampLimit(int limit) {
        if (limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
