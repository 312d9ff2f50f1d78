package io.schedule4j.spi;

import io.schedule4j.core.JobCommit;
import io.schedule4j.core.JobFilter;
import io.schedule4j.core.RunStatus;
import io.schedule4j.core.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for job definitions and their scheduling state.
 *
 * <p>The scheduler issues exactly two writes per job per tick: {@link #tryAcquireLease} and
 * {@link #commit}. Both must execute as a single atomic statement against the shared store;
 * implementations must never emulate them with a separate read followed by a write.
 *
 * <p>Implementations signal infrastructure failures with {@link io.schedule4j.core.JobStoreException}.
 */
public interface JobStore {

    /**
     * Jobs with {@code enabled=true AND (nextRunAfter IS NULL OR nextRunAfter <= now)}, in no particular order.
     */
    List<ScheduledJob> selectDue(Instant now);

    /**
     * Conditional update: {@code SET lockUntil = :lockUntil WHERE taskId = :taskId AND enabled = true
     * AND (lockUntil IS NULL OR lockUntil <= :now)}.
     *
     * @return true when this caller obtained the lease
     */
    boolean tryAcquireLease(String taskId, Instant now, Instant lockUntil);

    /**
     * Clears the lease and writes the outcome in one statement. Counters are incremented relative to
     * the stored value; {@code enabled} is only ever written as {@code false}.
     *
     * @return false when the job no longer exists
     */
    boolean commit(String taskId, JobCommit commit);

    /**
     * Stamps a manual run: increments counters and sets last-run fields without touching the lease or schedule.
     *
     * @return false when the job no longer exists
     */
    boolean recordManualRun(String taskId, RunStatus status, Instant startedAt, Instant finishedAt);

    Optional<ScheduledJob> findById(String taskId);

    List<ScheduledJob> find(JobFilter filter);

    /**
     * @return false when a job with the same task id already exists
     */
    boolean insert(ScheduledJob job);

    /**
     * Overwrites the definition fields (name, description, enabled, schedule, config) of an existing job.
     * Counters, lease and last-run fields are left untouched. {@code nextRunAfter} is written only when
     * {@code resetNextRun} is set.
     *
     * @return false when the job does not exist
     */
    boolean updateDefinition(ScheduledJob job, boolean resetNextRun);

    boolean delete(String taskId);
}
