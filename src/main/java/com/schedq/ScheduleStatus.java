package com.schedq;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScheduleStatus {
    ACTIVE,
    INACTIVE,
    EXPIRED,
    PAUSED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
