package com.schedq.queue;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueueItemState {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED,
    DELAYED,
    PAUSED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static QueueItemState fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Queue item state must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown queue item state: " + value, e);
        }
    }
}
