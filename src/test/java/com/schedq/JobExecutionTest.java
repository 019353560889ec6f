package com.schedq;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobExecutionTest {

    @Test
    void shouldNumberAttemptFromJobRetryCount() {
        Job job = new Job(UUID.randomUUID(), "sync", JobType.SYNC, new ObjectMapper().createObjectNode(), 10, 3);
        job.setRetryCount(2);

        JobExecution execution = JobExecution.start(job);

        assertEquals(job.getId(), execution.getJobId());
        assertEquals(3, execution.getRetryAttempt());
        assertEquals(10, execution.getPriority());
        assertEquals(ExecutionStatus.RUNNING, execution.getStatus());
    }

    @Test
    void shouldFinishExactlyOnce() {
        JobExecution execution = new JobExecution(UUID.randomUUID(), UUID.randomUUID(), 1, 1);

        assertTrue(execution.markAsCancelled());
        assertFalse(execution.markAsCompleted("late result"));
        assertFalse(execution.markAsFailed("late failure", null));
        assertFalse(execution.markAsTimeout());

        assertEquals(ExecutionStatus.CANCELLED, execution.getStatus());
        assertNotNull(execution.getDurationMs());
        assertNotNull(execution.getCompletedAt());
    }

    @Test
    void shouldRecordTimeoutMessage() {
        JobExecution execution = new JobExecution(UUID.randomUUID(), UUID.randomUUID(), 1, 1);

        assertTrue(execution.markAsTimeout());

        assertEquals(ExecutionStatus.TIMEOUT, execution.getStatus());
        assertEquals("Execution timed out", execution.getErrorMessage());
    }
}
