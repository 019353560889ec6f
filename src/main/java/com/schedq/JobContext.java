package com.schedq;

import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * What a {@link JobHandler} knows about the attempt it is running. Raw queue items carry no job, so
 * {@link #getJobId()} and {@link #getExecutionId()} may be {@code null}.
 */
public final class JobContext {

    private final UUID jobId;
    private final UUID executionId;
    private final int attempt;
    private final String workerId;
    private final BooleanSupplier cancellationCheck;

    public JobContext(UUID jobId, UUID executionId, int attempt, String workerId, BooleanSupplier cancellationCheck) {
        this.jobId = jobId;
        this.executionId = executionId;
        this.attempt = attempt;
        this.workerId = workerId;
        this.cancellationCheck = cancellationCheck;
    }

    public UUID getJobId() {
        return jobId;
    }

    public UUID getExecutionId() {
        return executionId;
    }

    public int getAttempt() {
        return attempt;
    }

    public String getWorkerId() {
        return workerId;
    }

    /**
     * Long running handlers should poll this and stop early; the engine ignores results reported for a
     * cancelled job.
     */
    public boolean isCancellationRequested() {
        return cancellationCheck != null && cancellationCheck.getAsBoolean();
    }
}
