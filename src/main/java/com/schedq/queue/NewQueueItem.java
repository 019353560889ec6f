package com.schedq.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Fully resolved enqueue request handed to a {@link QueueBackend}.
 */
public record NewQueueItem(
        String itemId,
        String name,
        JsonNode data,
        UUID ownerId,
        int priority,
        long delayMs,
        int attempts,
        long backoffDelayMs,
        int removeOnComplete,
        int removeOnFail) {
}
