package com.schedq;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;

public record ScheduleSpec(
        String cronExpression,
        String timezone,
        Boolean isActive,
        OffsetDateTime startAt,
        OffsetDateTime endAt,
        Integer maxExecutions,
        JsonNode metadata) {

    public static ScheduleSpec cron(String cronExpression) {
        return new ScheduleSpec(cronExpression, null, null, null, null, null, null);
    }
}
