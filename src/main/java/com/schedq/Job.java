package com.schedq;

import com.fasterxml.jackson.databind.JsonNode;
import com.schedq.util.BackoffCalculator;
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
 * A unit of deferred work.
 * <p>
 * Lifecycle: {@code PENDING -> RUNNING -> COMPLETED | FAILED | RETRY | CANCELLED}, with {@code RETRY} returning to
 * {@code RUNNING} on the next attempt. {@code PAUSED} is reachable from any non-terminal status and resumes to
 * {@code PENDING}. {@code retryCount} never exceeds {@code maxRetries}.
 */
@Entity
@Table(name = "schedq_jobs")
public class Job {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode payload;

    @Column(name = "priority")
    private int priority = 1;

    @Column(name = "max_retries")
    private int maxRetries = 3;

    @Column(name = "retry_count")
    private int retryCount = 0;

    @Column(name = "timeout_ms")
    private Long timeoutMs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "failed_at")
    private OffsetDateTime failedAt;

    @Column(name = "next_retry_at")
    private OffsetDateTime nextRetryAt;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_details", columnDefinition = "jsonb")
    private JsonNode errorDetails;

    protected Job() {
    }

    public Job(UUID id, String name, JobType type, JsonNode payload, int priority, int maxRetries) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.payload = payload;
        this.priority = priority;
        this.maxRetries = maxRetries;
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

    public boolean isExecutable() {
        return status == JobStatus.PENDING || status == JobStatus.RETRY;
    }

    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public boolean isPaused() {
        return status == JobStatus.PAUSED;
    }

    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }

    public boolean isTerminal() {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED || status == JobStatus.CANCELLED;
    }

    public void markAsRunning() {
        if (!isExecutable()) {
            throw new IllegalStateException("Job " + id + " cannot start from status " + status);
        }
        OffsetDateTime now = OffsetDateTime.now();
        this.status = JobStatus.RUNNING;
        this.startedAt = now;
        this.nextRetryAt = null;
        this.updatedAt = now;
    }

    public void markAsCompleted() {
        OffsetDateTime now = OffsetDateTime.now();
        this.status = JobStatus.COMPLETED;
        this.completedAt = now;
        this.nextRetryAt = null;
        this.updatedAt = now;
    }

    /**
     * Records a failed attempt. While retries remain, one is consumed and the job moves to {@code RETRY} with
     * {@code nextRetryAt} set from {@link BackoffCalculator#jobRetryDelay(int)}; otherwise it ends {@code FAILED}.
     */
    public void markAsFailed(String error, JsonNode details) {
        OffsetDateTime now = OffsetDateTime.now();
        this.failedAt = now;
        this.errorMessage = error;
        this.errorDetails = details;
        this.updatedAt = now;
        if (canRetry()) {
            this.retryCount++;
            this.status = JobStatus.RETRY;
            this.nextRetryAt = now.plus(BackoffCalculator.jobRetryDelay(retryCount));
        } else {
            this.status = JobStatus.FAILED;
            this.nextRetryAt = null;
        }
    }

    /**
     * Grants one more attempt to a terminally failed job, due immediately.
     */
    public void markForRetry() {
        if (status != JobStatus.FAILED || !canRetry()) {
            throw new IllegalStateException("Job " + id + " cannot be retried from status " + status
                    + " with " + retryCount + "/" + maxRetries + " retries used");
        }
        OffsetDateTime now = OffsetDateTime.now();
        this.retryCount++;
        this.status = JobStatus.RETRY;
        this.nextRetryAt = now;
        this.updatedAt = now;
    }

    public void markAsPaused() {
        if (isTerminal()) {
            throw new IllegalStateException("Job " + id + " cannot be paused from status " + status);
        }
        this.status = JobStatus.PAUSED;
        this.updatedAt = OffsetDateTime.now();
    }

    public void markAsCancelled() {
        OffsetDateTime now = OffsetDateTime.now();
        this.status = JobStatus.CANCELLED;
        this.completedAt = now;
        this.nextRetryAt = null;
        this.updatedAt = now;
    }

    /**
     * PAUSED back to PENDING. Retry counters and error fields are kept.
     */
    public boolean resume() {
        if (status != JobStatus.PAUSED) {
            return false;
        }
        this.status = JobStatus.PENDING;
        this.updatedAt = OffsetDateTime.now();
        return true;
    }

    public void reset() {
        this.status = JobStatus.PENDING;
        this.retryCount = 0;
        this.startedAt = null;
        this.completedAt = null;
        this.failedAt = null;
        this.nextRetryAt = null;
        this.errorMessage = null;
        this.errorDetails = null;
        this.updatedAt = OffsetDateTime.now();
    }

    /**
     * Milliseconds between start and completion (or now while still running), {@code null} if never started.
     */
    public Long getDuration() {
        if (startedAt == null) {
            return null;
        }
        OffsetDateTime end = completedAt != null ? completedAt : failedAt != null ? failedAt : OffsetDateTime.now();
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public int getProgress() {
        if (status == JobStatus.COMPLETED) {
            return 100;
        }
        if (status == JobStatus.RUNNING) {
            return 50;
        }
        return 0;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public JobType getType() {
        return type;
    }

    public void setType(JobType type) {
        this.type = type;
    }

    public JobStatus getStatus() {
        return status;
    }

    void setStatus(JobStatus status) {
        this.status = status;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getRetryCount() {
        return retryCount;
    }

    void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Long timeoutMs) {
        this.timeoutMs = timeoutMs;
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

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public OffsetDateTime getFailedAt() {
        return failedAt;
    }

    public OffsetDateTime getNextRetryAt() {
        return nextRetryAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public JsonNode getErrorDetails() {
        return errorDetails;
    }
}
