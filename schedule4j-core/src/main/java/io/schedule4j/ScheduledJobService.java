package io.schedule4j;

import io.schedule4j.core.JobDefinition;
import io.schedule4j.core.JobFilter;
import io.schedule4j.core.JobUpdate;
import io.schedule4j.core.ScheduledJob;

import java.time.Instant;
import java.util.List;

/**
 * Administrative operations on job definitions.
 */
public interface ScheduledJobService {

    int DEFAULT_PREVIEW_LIMIT = 5;

    /**
     * Validate and persist a new job. A blank task id is generated from the handler id.
     *
     * @throws io.schedule4j.core.JobValidationException on invalid input
     * @throws io.schedule4j.core.JobConflictException   when the task id is taken
     */
    ScheduledJob create(JobDefinition definition);

    /**
     * @throws io.schedule4j.core.JobNotFoundException when no such job exists
     */
    ScheduledJob get(String taskId);

    List<ScheduledJob> list(JobFilter filter);

    /**
     * Apply a partial update. {@code nextRunAfter} is recomputed when the schedule changes or the job is
     * re-enabled.
     */
    ScheduledJob update(String taskId, JobUpdate update);

    /**
     * @throws io.schedule4j.core.JobNotFoundException when no such job exists
     */
    void delete(String taskId);

    /**
     * Upcoming run times for display, starting at {@code nextRunAfter}. Empty for disabled jobs and for jobs
     * that have no next run time yet.
     */
    List<Instant> previewNextRuns(ScheduledJob job, int limit);
}
