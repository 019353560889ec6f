package com.schedq;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Cron recurrence attached to exactly one {@link Job}.
 * <p>
 * A schedule is active only while {@code isActive}, in status {@code ACTIVE}, inside its
 * {@code [startAt, endAt]} window and below {@code maxExecutions}. Reaching {@code maxExecutions} expires it.
 */
@Entity
@Table(name = "schedq_schedules")
public class Schedule {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false, unique = true)
    private UUID jobId;

    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Column(nullable = false, length = 50)
    private String timezone = "UTC";

    @Column(name = "start_at")
    private OffsetDateTime startAt;

    @Column(name = "end_at")
    private OffsetDateTime endAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ScheduleStatus status = ScheduleStatus.ACTIVE;

    @Column(name = "last_execution")
    private OffsetDateTime lastExecution;

    @Column(name = "next_execution")
    private OffsetDateTime nextExecution;

    @Column(name = "execution_count")
    private int executionCount = 0;

    @Column(name = "max_executions")
    private Integer maxExecutions;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    protected Schedule() {
    }

    public Schedule(UUID id, UUID jobId, String cronExpression, String timezone) {
        this.id = id;
        this.jobId = jobId;
        this.cronExpression = cronExpression;
        this.timezone = timezone;
        this.createdAt = OffsetDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
        updatedAt = OffsetDateTime.now();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }

    public boolean isScheduleActive() {
        return isScheduleActive(OffsetDateTime.now());
    }

    public boolean isScheduleActive(OffsetDateTime now) {
        if (!active || status != ScheduleStatus.ACTIVE) {
            return false;
        }
        if (startAt != null && now.isBefore(startAt)) {
            return false;
        }
        if (endAt != null && now.isAfter(endAt)) {
            return false;
        }
        return maxExecutions == null || executionCount < maxExecutions;
    }

    public boolean shouldExecuteNow() {
        return shouldExecuteNow(OffsetDateTime.now());
    }

    public boolean shouldExecuteNow(OffsetDateTime now) {
        return isScheduleActive(now) && nextExecution != null && !now.isBefore(nextExecution);
    }

    public void recordExecution() {
        recordExecution(OffsetDateTime.now());
    }

    public void recordExecution(OffsetDateTime now) {
        this.executionCount++;
        this.lastExecution = now;
        this.updatedAt = now;
        if (maxExecutions != null && executionCount >= maxExecutions) {
            expire();
        }
    }

    public boolean pause() {
        if (status != ScheduleStatus.ACTIVE) {
            return false;
        }
        this.status = ScheduleStatus.PAUSED;
        this.active = false;
        this.updatedAt = OffsetDateTime.now();
        return true;
    }

    /**
     * No-op unless the schedule is exactly {@code PAUSED}; expired and deactivated schedules stay put.
     */
    public boolean resume() {
        if (status != ScheduleStatus.PAUSED) {
            return false;
        }
        this.status = ScheduleStatus.ACTIVE;
        this.active = true;
        this.updatedAt = OffsetDateTime.now();
        return true;
    }

    public void deactivate() {
        this.status = ScheduleStatus.INACTIVE;
        this.active = false;
        this.nextExecution = null;
        this.updatedAt = OffsetDateTime.now();
    }

    public void expire() {
        this.status = ScheduleStatus.EXPIRED;
        this.active = false;
        this.nextExecution = null;
        this.updatedAt = OffsetDateTime.now();
    }

    public void setExecutionWindow(OffsetDateTime startAt, OffsetDateTime endAt) {
        setExecutionWindow(startAt, endAt, OffsetDateTime.now());
    }

    /**
     * Replaces the window of an existing schedule. If the schedule is no longer active under the new window
     * (it opens later, has already closed, or the schedule is paused) it is deactivated.
     */
    public void setExecutionWindow(OffsetDateTime startAt, OffsetDateTime endAt, OffsetDateTime now) {
        initWindow(startAt, endAt);
        this.updatedAt = now;
        if (!isFinished() && !isScheduleActive(now)) {
            deactivate();
        }
    }

    /**
     * Sets the window of a schedule that is being created, where a window opening in the future is expected.
     */
    void initWindow(OffsetDateTime startAt, OffsetDateTime endAt) {
        if (startAt != null && endAt != null && endAt.isBefore(startAt)) {
            throw new IllegalArgumentException("endAt must not be before startAt");
        }
        this.startAt = startAt;
        this.endAt = endAt;
    }

    public void setMaxExecutions(Integer maxExecutions) {
        if (maxExecutions != null && maxExecutions < 1) {
            throw new IllegalArgumentException("maxExecutions must be >= 1");
        }
        this.maxExecutions = maxExecutions;
        this.updatedAt = OffsetDateTime.now();
        if (maxExecutions != null && executionCount >= maxExecutions && status != ScheduleStatus.INACTIVE) {
            expire();
        }
    }

    public boolean isFinished() {
        return status == ScheduleStatus.EXPIRED || status == ScheduleStatus.INACTIVE;
    }

    public boolean isExpired() {
        return isExpired(OffsetDateTime.now());
    }

    public boolean isExpired(OffsetDateTime now) {
        if (status == ScheduleStatus.EXPIRED) {
            return true;
        }
        if (endAt != null && now.isAfter(endAt)) {
            return true;
        }
        return maxExecutions != null && executionCount >= maxExecutions;
    }

    public Integer getRemainingExecutions() {
        if (maxExecutions == null) {
            return null;
        }
        return Math.max(0, maxExecutions - executionCount);
    }

    public int getExecutionProgress() {
        if (maxExecutions == null) {
            return 0;
        }
        return (int) Math.min(100, Math.round(executionCount * 100.0 / maxExecutions));
    }

    /**
     * Milliseconds until the next fire time, {@code null} when nothing is scheduled.
     */
    public Long getTimeUntilNextExecution() {
        if (nextExecution == null) {
            return null;
        }
        return Math.max(0L, Duration.between(OffsetDateTime.now(), nextExecution).toMillis());
    }

    public UUID getId() {
        return id;
    }

    public UUID getJobId() {
        return jobId;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public OffsetDateTime getStartAt() {
        return startAt;
    }

    public OffsetDateTime getEndAt() {
        return endAt;
    }

    @JsonProperty("isActive")
    public boolean isActive() {
        return active;
    }

    public ScheduleStatus getStatus() {
        return status;
    }

    public OffsetDateTime getLastExecution() {
        return lastExecution;
    }

    public OffsetDateTime getNextExecution() {
        return nextExecution;
    }

    public void setNextExecution(OffsetDateTime nextExecution) {
        this.nextExecution = nextExecution;
    }

    public int getExecutionCount() {
        return executionCount;
    }

    public Integer getMaxExecutions() {
        return maxExecutions;
    }

    public JsonNode getMetadata() {
        return metadata;
    }

    public void setMetadata(JsonNode metadata) {
        this.metadata = metadata;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
