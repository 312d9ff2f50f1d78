package io.schedule4j.internal;

import io.schedule4j.core.JobCommit;
import io.schedule4j.core.JobFilter;
import io.schedule4j.core.RunStatus;
import io.schedule4j.core.ScheduleUpdate;
import io.schedule4j.core.ScheduledJob;
import io.schedule4j.spi.JobStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * {@link JobStore} kept in a {@link ConcurrentHashMap}, for tests and single-process embedding.
 *
 * <p>Every conditional write runs inside {@code compute}/{@code computeIfPresent}, which serialises writers per key
 * the same way a document store serialises updates to one document.
 */
public class InMemoryJobStore implements JobStore {

    private final ConcurrentMap<String, ScheduledJob> jobs = new ConcurrentHashMap<>();

    @Override
    public List<ScheduledJob> selectDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return jobs.values().stream()
                .filter(job -> job.isDue(now))
                .sorted(Comparator.comparing(ScheduledJob::taskId))
                .collect(Collectors.toList());
    }

    @Override
    public boolean tryAcquireLease(String taskId, Instant now, Instant lockUntil) {
        AtomicBoolean acquired = new AtomicBoolean(false);
        jobs.computeIfPresent(taskId, (id, job) -> {
            if (!job.enabled() || !job.isLeaseFree(now)) {
                return job;
            }
            acquired.set(true);
            return job.toBuilder().lockUntil(lockUntil).build();
        });
        return acquired.get();
    }

    @Override
    public boolean commit(String taskId, JobCommit commit) {
        Objects.requireNonNull(commit, "commit must not be null");
        ScheduleUpdate update = commit.update();
        ScheduledJob updated = jobs.computeIfPresent(taskId, (id, job) -> job.toBuilder()
                .lockUntil(null)
                .lastRunStatus(commit.status())
                .lastRunStartedAt(commit.startedAt())
                .lastRunFinishedAt(commit.finishedAt())
                .nextRunAfter(update.nextRunAfter())
                .enabled(job.enabled() && update.enabled())
                .runCount(job.runCount() + update.runCountDelta())
                .failureCount(job.failureCount() + update.failureCountDelta())
                .updatedAt(commit.finishedAt())
                .build());
        return updated != null;
    }

    @Override
    public boolean recordManualRun(String taskId, RunStatus status, Instant startedAt, Instant finishedAt) {
        ScheduledJob updated = jobs.computeIfPresent(taskId, (id, job) -> job.toBuilder()
                .lastRunStatus(status)
                .lastRunStartedAt(startedAt)
                .lastRunFinishedAt(finishedAt)
                .runCount(job.runCount() + (status.isAttempt() ? 1 : 0))
                .failureCount(job.failureCount() + (status == RunStatus.FAILURE ? 1 : 0))
                .updatedAt(finishedAt)
                .build());
        return updated != null;
    }

    @Override
    public Optional<ScheduledJob> findById(String taskId) {
        return Optional.ofNullable(jobs.get(taskId));
    }

    @Override
    public List<ScheduledJob> find(JobFilter filter) {
        JobFilter f = filter == null ? JobFilter.all() : filter;
        return jobs.values().stream()
                .filter(f::matches)
                .sorted(Comparator.comparing(ScheduledJob::taskId))
                .collect(Collectors.toList());
    }

    @Override
    public boolean insert(ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");
        return jobs.putIfAbsent(job.taskId(), job) == null;
    }

    @Override
    public boolean updateDefinition(ScheduledJob job, boolean resetNextRun) {
        Objects.requireNonNull(job, "job must not be null");
        ScheduledJob updated = jobs.computeIfPresent(job.taskId(), (id, current) -> {
            ScheduledJob.Builder b = current.toBuilder()
                    .name(job.name())
                    .description(job.description())
                    .enabled(job.enabled())
                    .schedule(job.schedule())
                    .configJson(job.configJson())
                    .updatedAt(job.updatedAt());
            if (resetNextRun) {
                b.nextRunAfter(job.nextRunAfter());
            }
            return b.build();
        });
        return updated != null;
    }

    @Override
    public boolean delete(String taskId) {
        return jobs.remove(taskId) != null;
    }

    /**
     * Seeds a job as-is, replacing any existing entry. Bypasses validation.
     */
    public void put(ScheduledJob job) {
        jobs.put(job.taskId(), job);
    }
}
