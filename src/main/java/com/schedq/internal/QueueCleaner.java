package com.schedq.internal;

import com.schedq.config.SchedQProperties;
import com.schedq.queue.QueueItemState;
import com.schedq.queue.QueueRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

@Component
@ConditionalOnProperty(prefix = "schedq.cleaner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class QueueCleaner {

    private static final Logger log = LoggerFactory.getLogger(QueueCleaner.class);
    private final QueueRouter queueRouter;
    private final SchedQProperties properties;

    public QueueCleaner(QueueRouter queueRouter, SchedQProperties properties) {
        this.queueRouter = queueRouter;
        this.properties = properties;
    }

    // Hourly
    @Scheduled(fixedDelay = 3600000, initialDelay = 60000)
    public void cleanup() {
        log.info("Running queue cleanup task...");
        clean(QueueItemState.COMPLETED, properties.getCleaner().getCompletedRetention());
        clean(QueueItemState.FAILED, properties.getCleaner().getFailedRetention());
    }

    private void clean(QueueItemState state, String retentionValue) {
        if (retentionValue == null || retentionValue.isBlank()) {
            return;
        }
        try {
            Duration retention = parseDuration(retentionValue);
            Map<String, Integer> removed = queueRouter.cleanQueue(state, retention.toMillis());
            int total = removed.values().stream().mapToInt(Integer::intValue).sum();
            if (total > 0) {
                log.info("Cleaned up {} {} queue items older than {}", total, state.getValue(), retention);
            }
        } catch (Exception e) {
            log.error("Failed to clean up {} queue items: {}", state.getValue(), e.getMessage());
        }
    }

    /**
     * Accepts ISO-8601 durations as well as shorthand such as {@code 30m}, {@code 36h} or {@code 7d}.
     */
    static Duration parseDuration(String value) {
        String trimmed = value.trim();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith("P")) {
            return Duration.parse(trimmed);
        }

        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        if (shorthand.length() < 2) {
            throw new IllegalArgumentException("Unsupported duration value: " + value);
        }
        long amount;
        try {
            amount = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported duration value: " + value, e);
        }
        return switch (shorthand.charAt(shorthand.length() - 1)) {
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("Unsupported duration value: " + value);
        };
    }
}
