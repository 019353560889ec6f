package com.schedq.queue;

import java.util.UUID;

/**
 * Caller supplied enqueue options. {@code null} components fall back to the router defaults.
 *
 * @param ownerId job or schedule the item belongs to, used for bulk pause, resume and removal
 */
public record QueueOptions(
        Integer priority,
        Long delayMs,
        Integer attempts,
        Long backoffDelayMs,
        Integer removeOnComplete,
        Integer removeOnFail,
        String itemId,
        UUID ownerId) {

    public static QueueOptions none() {
        return new QueueOptions(null, null, null, null, null, null, null, null);
    }

    public QueueOptions withPriority(Integer value) {
        return new QueueOptions(value, delayMs, attempts, backoffDelayMs, removeOnComplete, removeOnFail, itemId, ownerId);
    }

    public QueueOptions withDelayMs(Long value) {
        return new QueueOptions(priority, value, attempts, backoffDelayMs, removeOnComplete, removeOnFail, itemId, ownerId);
    }

    public QueueOptions withAttempts(Integer value) {
        return new QueueOptions(priority, delayMs, value, backoffDelayMs, removeOnComplete, removeOnFail, itemId, ownerId);
    }

    public QueueOptions withItemId(String value) {
        return new QueueOptions(priority, delayMs, attempts, backoffDelayMs, removeOnComplete, removeOnFail, value, ownerId);
    }

    public QueueOptions withOwnerId(UUID value) {
        return new QueueOptions(priority, delayMs, attempts, backoffDelayMs, removeOnComplete, removeOnFail, itemId, value);
    }
}
