package io.schedule4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one persisted job definition together with its scheduling state.
 *
 * <p>{@code schedule} is null when the persisted schedule kind is not recognised; such a job is
 * disabled by the first tick that leases it.
 */
public record ScheduledJob(

        // identity
        String taskId,
        String handlerId,
        String name,
        String description,

        // scheduling
        boolean enabled,
        Schedule schedule,
        Instant nextRunAfter,
        Instant lockUntil,

        // run statistics
        long runCount,
        long failureCount,
        RunStatus lastRunStatus,
        Instant lastRunStartedAt,
        Instant lastRunFinishedAt,

        // payload
        String configJson,

        Instant createdAt,
        Instant updatedAt
) {

    public ScheduledJob {
        Objects.requireNonNull(taskId, "taskId must not be null");
    }

    /**
     * True when nobody holds an unexpired lease at {@code now}.
     */
    public boolean isLeaseFree(Instant now) {
        return lockUntil == null || !lockUntil.isAfter(now);
    }

    /**
     * True when the job is enabled and its next run time has been reached.
     */
    public boolean isDue(Instant now) {
        return enabled && (nextRunAfter == null || !nextRunAfter.isAfter(now));
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder(String taskId) {
        return new Builder(taskId);
    }

    public static final class Builder {
        private String taskId;
        private String handlerId;
        private String name;
        private String description;
        private boolean enabled;
        private Schedule schedule;
        private Instant nextRunAfter;
        private Instant lockUntil;
        private long runCount;
        private long failureCount;
        private RunStatus lastRunStatus;
        private Instant lastRunStartedAt;
        private Instant lastRunFinishedAt;
        private String configJson = "{}";
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String taskId) {
            this.taskId = taskId;
        }

        private Builder(ScheduledJob job) {
            this.taskId = job.taskId;
            this.handlerId = job.handlerId;
            this.name = job.name;
            this.description = job.description;
            this.enabled = job.enabled;
            this.schedule = job.schedule;
            this.nextRunAfter = job.nextRunAfter;
            this.lockUntil = job.lockUntil;
            this.runCount = job.runCount;
            this.failureCount = job.failureCount;
            this.lastRunStatus = job.lastRunStatus;
            this.lastRunStartedAt = job.lastRunStartedAt;
            this.lastRunFinishedAt = job.lastRunFinishedAt;
            this.configJson = job.configJson;
            this.createdAt = job.createdAt;
            this.updatedAt = job.updatedAt;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder handlerId(String handlerId) {
            this.handlerId = handlerId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder schedule(Schedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder nextRunAfter(Instant nextRunAfter) {
            this.nextRunAfter = nextRunAfter;
            return this;
        }

        public Builder lockUntil(Instant lockUntil) {
            this.lockUntil = lockUntil;
            return this;
        }

        public Builder runCount(long runCount) {
            this.runCount = runCount;
            return this;
        }

        public Builder failureCount(long failureCount) {
            this.failureCount = failureCount;
            return this;
        }

        public Builder lastRunStatus(RunStatus lastRunStatus) {
            this.lastRunStatus = lastRunStatus;
            return this;
        }

        public Builder lastRunStartedAt(Instant lastRunStartedAt) {
            this.lastRunStartedAt = lastRunStartedAt;
            return this;
        }

        public Builder lastRunFinishedAt(Instant lastRunFinishedAt) {
            this.lastRunFinishedAt = lastRunFinishedAt;
            return this;
        }

        public Builder configJson(String configJson) {
            this.configJson = configJson;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ScheduledJob build() {
            return new ScheduledJob(
                    taskId,
                    handlerId,
                    name,
                    description,
                    enabled,
                    schedule,
                    nextRunAfter,
                    lockUntil,
                    runCount,
                    failureCount,
                    lastRunStatus,
                    lastRunStartedAt,
                    lastRunFinishedAt,
                    configJson,
                    createdAt,
                    updatedAt
            );
        }
    }
}
