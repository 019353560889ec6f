package com.schedq.queue;

import java.util.Map;

public record QueueHealth(boolean healthy, Map<String, QueueStatus> queues, QueueCounts total) {

    public record QueueStatus(boolean healthy, boolean paused, QueueCounts counts) {
    }
}
