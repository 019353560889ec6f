package com.schedq;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Partial update of a job; {@code null} components are left unchanged.
 */
public record JobPatch(
        String name,
        JobType type,
        JsonNode payload,
        Integer priority,
        Integer maxRetries,
        JsonNode metadata,
        Long timeoutMs) {
}
