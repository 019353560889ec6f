package com.schedq.queue;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueueName {
    SCHEDULER("scheduler"),
    PRIORITY("priority"),
    DELAYED("delayed");

    private final String value;

    QueueName(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static QueueName fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (QueueName queue : values()) {
                if (queue.value.equals(normalized)) {
                    return queue;
                }
            }
        }
        throw new IllegalArgumentException("Unknown queue: " + value);
    }
}
