package com.schedq;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Tag selecting which {@link JobHandler} processes a job.
 */
public enum JobType {
    MESSAGE_DELIVERY,
    NOTIFICATION,
    CLEANUP,
    MAINTENANCE,
    REPORT,
    ANALYTICS,
    BACKUP,
    SYNC;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job type: " + value, e);
        }
    }
}
