package io.schedule4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for persisted scheduled jobs. The document id is the task id.
 */
@Document(collection = "scheduled_jobs")
public class ScheduledJobDocument {

    @Id
    private String id;

    private String handlerId;
    private String name;
    private String description;
    private boolean enabled;

    private String scheduleType;
    private Long intervalSec;
    private String cronExpression;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAfter;

    @Field(write = Field.Write.ALWAYS)
    private Instant lockUntil;

    private long runCount;
    private long failureCount;
    private String lastRunStatus;
    private Instant lastRunStartedAt;
    private Instant lastRunFinishedAt;

    private String configJson;

    private Instant createdAt;
    private Instant updatedAt;

    public ScheduledJobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getHandlerId() {
        return handlerId;
    }

    public void setHandlerId(String handlerId) {
        this.handlerId = handlerId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getScheduleType() {
        return scheduleType;
    }

    public void setScheduleType(String scheduleType) {
        this.scheduleType = scheduleType;
    }

    public Long getIntervalSec() {
        return intervalSec;
    }

    public void setIntervalSec(Long intervalSec) {
        this.intervalSec = intervalSec;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public Instant getNextRunAfter() {
        return nextRunAfter;
    }

    public void setNextRunAfter(Instant nextRunAfter) {
        this.nextRunAfter = nextRunAfter;
    }

    public Instant getLockUntil() {
        return lockUntil;
    }

    public void setLockUntil(Instant lockUntil) {
        this.lockUntil = lockUntil;
    }

    public long getRunCount() {
        return runCount;
    }

    public void setRunCount(long runCount) {
        this.runCount = runCount;
    }

    public long getFailureCount() {
        return failureCount;
    }

    public void setFailureCount(long failureCount) {
        this.failureCount = failureCount;
    }

    public String getLastRunStatus() {
        return lastRunStatus;
    }

    public void setLastRunStatus(String lastRunStatus) {
        this.lastRunStatus = lastRunStatus;
    }

    public Instant getLastRunStartedAt() {
        return lastRunStartedAt;
    }

    public void setLastRunStartedAt(Instant lastRunStartedAt) {
        this.lastRunStartedAt = lastRunStartedAt;
    }

    public Instant getLastRunFinishedAt() {
        return lastRunFinishedAt;
    }

    public void setLastRunFinishedAt(Instant lastRunFinishedAt) {
        this.lastRunFinishedAt = lastRunFinishedAt;
    }

    public String getConfigJson() {
        return configJson;
    }

    public void setConfigJson(String configJson) {
        this.configJson = configJson;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
