package com.schedq.queue;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QueueCounts(long waiting, long active, long completed, long failed, long delayed, long paused) {

    public static QueueCounts empty() {
        return new QueueCounts(0, 0, 0, 0, 0, 0);
    }

    public QueueCounts plus(QueueCounts other) {
        return new QueueCounts(
                waiting + other.waiting,
                active + other.active,
                completed + other.completed,
                failed + other.failed,
                delayed + other.delayed,
                paused + other.paused);
    }

    @JsonProperty("total")
    public long total() {
        return waiting + active + completed + failed + delayed + paused;
    }

    public long count(QueueItemState state) {
        return switch (state) {
            case WAITING -> waiting;
            case ACTIVE -> active;
            case COMPLETED -> completed;
            case FAILED -> failed;
            case DELAYED -> delayed;
            case PAUSED -> paused;
        };
    }

    /**
     * Healthy while failures stay strictly below a tenth of completions. A queue that has neither completed nor
     * failed anything is healthy.
     */
    public boolean isHealthy() {
        if (completed == 0 && failed == 0) {
            return true;
        }
        return failed < completed * 0.1;
    }
}
