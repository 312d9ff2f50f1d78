package io.schedule4j.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.schedule4j.ScheduledJobService;
import io.schedule4j.core.JobConflictException;
import io.schedule4j.core.JobDefinition;
import io.schedule4j.core.JobFilter;
import io.schedule4j.core.JobNotFoundException;
import io.schedule4j.core.JobUpdate;
import io.schedule4j.core.JobValidationException;
import io.schedule4j.core.Schedule;
import io.schedule4j.core.ScheduleCalculator;
import io.schedule4j.core.ScheduledJob;
import io.schedule4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public class DefaultScheduledJobService implements ScheduledJobService {
    private static final Logger log = LoggerFactory.getLogger(DefaultScheduledJobService.class);

    private final JobStore jobStore;
    private final ScheduleCalculator scheduleCalculator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DefaultScheduledJobService(JobStore jobStore, ScheduleCalculator scheduleCalculator, ObjectMapper objectMapper) {
        this(jobStore, scheduleCalculator, objectMapper, Clock.systemUTC());
    }

    public DefaultScheduledJobService(JobStore jobStore,
                                      ScheduleCalculator scheduleCalculator,
                                      ObjectMapper objectMapper,
                                      Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.scheduleCalculator = Objects.requireNonNull(scheduleCalculator, "scheduleCalculator must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ScheduledJob create(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        String handlerId = definition.handlerId();
        if (handlerId == null || handlerId.isBlank()) {
            throw new JobValidationException("handlerId must not be blank");
        }
        Instant now = clock.instant();
        Instant firstRun = firstRunAfter(definition.schedule(), now);

        String taskId = definition.taskId() == null ? "" : definition.taskId().trim();
        if (taskId.isEmpty()) {
            taskId = generateTaskId(handlerId);
        }

        ScheduledJob job = ScheduledJob.builder(taskId)
                .handlerId(handlerId)
                .name(definition.name() == null || definition.name().isBlank() ? handlerId : definition.name())
                .description(definition.description())
                .enabled(definition.enabled())
                .schedule(definition.schedule())
                .nextRunAfter(firstRun)
                .configJson(toJson(definition.config()))
                .createdAt(now)
                .updatedAt(now)
                .build();

        if (!jobStore.insert(job)) {
            throw new JobConflictException("scheduled job already exists: " + taskId);
        }
        log.info("scheduled job created taskId={} handlerId={} schedule={} nextRunAfter={}",
                taskId, handlerId, job.schedule(), firstRun);
        return job;
    }

    @Override
    public ScheduledJob get(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new JobValidationException("taskId must not be blank");
        }
        return jobStore.findById(taskId)
                .orElseThrow(() -> new JobNotFoundException("scheduled job not found: " + taskId));
    }

    @Override
    public List<ScheduledJob> list(JobFilter filter) {
        return jobStore.find(filter == null ? JobFilter.all() : filter);
    }

    @Override
    public ScheduledJob update(String taskId, JobUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        if (update.isEmpty()) {
            throw new JobValidationException("update must change at least one field");
        }
        ScheduledJob current = get(taskId);
        Instant now = clock.instant();

        Schedule schedule = update.schedule() != null ? update.schedule() : current.schedule();
        boolean enabled = update.enabled() != null ? update.enabled() : current.enabled();
        boolean reEnabled = !current.enabled() && enabled;
        boolean resetNextRun = update.schedule() != null || reEnabled;

        ScheduledJob.Builder b = current.toBuilder()
                .enabled(enabled)
                .schedule(schedule)
                .updatedAt(now);
        if (update.name() != null) {
            b.name(update.name());
        }
        if (update.description() != null) {
            b.description(update.description());
        }
        if (update.config() != null) {
            b.configJson(toJson(update.config()));
        }
        if (resetNextRun) {
            b.nextRunAfter(firstRunAfter(schedule, now));
        }

        ScheduledJob updated = b.build();
        if (!jobStore.updateDefinition(updated, resetNextRun)) {
            throw new JobNotFoundException("scheduled job not found: " + taskId);
        }
        log.info("scheduled job updated taskId={} enabled={} resetNextRun={}", taskId, enabled, resetNextRun);
        return jobStore.findById(taskId).orElse(updated);
    }

    @Override
    public void delete(String taskId) {
        if (!jobStore.delete(taskId)) {
            throw new JobNotFoundException("scheduled job not found: " + taskId);
        }
        log.info("scheduled job deleted taskId={}", taskId);
    }

    @Override
    public List<Instant> previewNextRuns(ScheduledJob job, int limit) {
        Objects.requireNonNull(job, "job must not be null");
        List<Instant> runs = new ArrayList<>();
        if (!job.enabled() || job.nextRunAfter() == null || job.schedule() == null || limit <= 0) {
            return runs;
        }

        Instant next = job.nextRunAfter();
        runs.add(next);
        try {
            while (runs.size() < limit) {
                next = scheduleCalculator.nextRunAfter(job.schedule(), next);
                runs.add(next);
            }
        } catch (IllegalArgumentException e) {
            log.warn("cannot preview next runs taskId={} msg={}", job.taskId(), e.getMessage());
        }
        return runs;
    }

    private Instant firstRunAfter(Schedule schedule, Instant now) {
        if (schedule == null) {
            throw new JobValidationException("schedule must not be null");
        }
        try {
            return scheduleCalculator.nextRunAfter(schedule, now);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("invalid schedule: " + e.getMessage());
        }
    }

    private String toJson(Map<String, Object> config) {
        if (config == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new JobValidationException("config is not serializable: " + e.getOriginalMessage());
        }
    }

    static String generateTaskId(String handlerId) {
        String normalized = handlerId.replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase();
        if (normalized.isEmpty()) {
            normalized = "job";
        }
        return normalized + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
