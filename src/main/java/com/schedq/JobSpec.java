package com.schedq;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request to create a job. {@code priority}, {@code maxRetries}, {@code metadata} and {@code timeoutMs} are
 * optional.
 */
public record JobSpec(
        String name,
        JobType type,
        JsonNode payload,
        Integer priority,
        Integer maxRetries,
        JsonNode metadata,
        Long timeoutMs) {

    public static JobSpec of(String name, JobType type, JsonNode payload) {
        return new JobSpec(name, type, payload, null, null, null, null);
    }
}
