package com.schedq.queue;

import java.util.Map;

/**
 * Per-queue counts keyed by queue name, plus their sum.
 */
public record QueueStats(Map<String, QueueCounts> queues, QueueCounts total) {
}
