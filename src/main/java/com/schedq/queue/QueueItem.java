package com.schedq.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Snapshot of an item held by a queue backend.
 */
public record QueueItem(
        String id,
        QueueName queue,
        String name,
        JsonNode data,
        UUID ownerId,
        int priority,
        int attempts,
        int attemptsMade,
        long backoffDelayMs,
        QueueItemState state,
        String failedReason,
        String returnValue,
        OffsetDateTime createdAt,
        OffsetDateTime processAt,
        OffsetDateTime processedAt,
        OffsetDateTime finishedAt) {

    public boolean hasAttemptsLeft() {
        return attemptsMade < attempts;
    }
}
