package com.schedq;

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
 * One attempt to run a {@link Job}. Created {@code RUNNING}, moves to exactly one terminal status and is not
 * changed afterwards; later terminal transitions return {@code false} and leave the record untouched.
 */
@Entity
@Table(name = "schedq_job_executions")
public class JobExecution {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(columnDefinition = "text")
    private String output;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_details", columnDefinition = "jsonb")
    private JsonNode errorDetails;

    @Column(name = "retry_attempt")
    private int retryAttempt = 1;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "queue_name")
    private String queueName;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_context", columnDefinition = "jsonb")
    private JsonNode executionContext;

    @Column(name = "priority")
    private int priority = 1;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    protected JobExecution() {
    }

    public JobExecution(UUID id, UUID jobId, int retryAttempt, int priority) {
        this.id = id;
        this.jobId = jobId;
        this.retryAttempt = retryAttempt;
        this.priority = priority;
        this.startedAt = OffsetDateTime.now();
        this.createdAt = this.startedAt;
        this.updatedAt = this.startedAt;
    }

    /**
     * A new RUNNING execution for the job's current attempt.
     */
    public static JobExecution start(Job job) {
        return new JobExecution(UUID.randomUUID(), job.getId(), job.getRetryCount() + 1, job.getPriority());
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

    public boolean isFinished() {
        return status.isTerminal();
    }

    public boolean markAsCompleted(String output) {
        if (isFinished()) {
            return false;
        }
        this.output = output;
        finish(ExecutionStatus.COMPLETED);
        return true;
    }

    public boolean markAsFailed(String error, JsonNode details) {
        if (isFinished()) {
            return false;
        }
        this.errorMessage = error;
        this.errorDetails = details;
        finish(ExecutionStatus.FAILED);
        return true;
    }

    public boolean markAsTimeout() {
        if (isFinished()) {
            return false;
        }
        this.errorMessage = "Execution timed out";
        finish(ExecutionStatus.TIMEOUT);
        return true;
    }

    public boolean markAsCancelled() {
        if (isFinished()) {
            return false;
        }
        finish(ExecutionStatus.CANCELLED);
        return true;
    }

    private void finish(ExecutionStatus terminalStatus) {
        OffsetDateTime now = OffsetDateTime.now();
        this.status = terminalStatus;
        this.completedAt = now;
        this.durationMs = Math.max(0L, Duration.between(startedAt, now).toMillis());
        this.updatedAt = now;
    }

    public void setWorkerInfo(String workerId, String queueName) {
        this.workerId = workerId;
        this.queueName = queueName;
        this.updatedAt = OffsetDateTime.now();
    }

    public UUID getId() {
        return id;
    }

    public UUID getJobId() {
        return jobId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public String getOutput() {
        return output;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public JsonNode getErrorDetails() {
        return errorDetails;
    }

    public int getRetryAttempt() {
        return retryAttempt;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getQueueName() {
        return queueName;
    }

    public JsonNode getExecutionContext() {
        return executionContext;
    }

    public void setExecutionContext(JsonNode executionContext) {
        this.executionContext = executionContext;
    }

    public int getPriority() {
        return priority;
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
