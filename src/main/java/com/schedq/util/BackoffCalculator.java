package com.schedq.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential retry delays.
 * <p>
 * {@link #jobRetryDelay(int)} is the deterministic curve used for job retries: one minute doubled per attempt,
 * capped at a day. {@link #calculateBackoffDelay(int, long, long, double)} is the jittered curve used when a queue
 * item is redelivered by the backend.
 */
public final class BackoffCalculator {

    public static final long JOB_RETRY_BASE_MS = 60_000L;
    public static final long JOB_RETRY_CAP_MS = Duration.ofHours(24).toMillis();
    public static final double DEFAULT_MULTIPLIER = 2.0;
    private static final double JITTER_RATIO = 0.1;

    private final DoubleSupplier random;

    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffCalculator(DoubleSupplier random) {
        this.random = random;
    }

    /**
     * Delay before the given 1-indexed retry attempt: {@code min(2^attempt * 60s, 24h)}.
     */
    public static Duration jobRetryDelay(int retryAttempt) {
        if (retryAttempt < 1) {
            throw new IllegalArgumentException("retryAttempt must be >= 1 but was " + retryAttempt);
        }
        // 2^11 minutes is already past the cap; avoid overflowing the shift.
        if (retryAttempt >= 11) {
            return Duration.ofMillis(JOB_RETRY_CAP_MS);
        }
        long delay = (1L << retryAttempt) * JOB_RETRY_BASE_MS;
        return Duration.ofMillis(Math.min(delay, JOB_RETRY_CAP_MS));
    }

    /**
     * {@code min(base * multiplier^(attempt-1), max)} plus up to 10% additive jitter.
     */
    public long calculateBackoffDelay(int attempt, long baseDelayMs, long maxDelayMs, double multiplier) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1 but was " + attempt);
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        double exponential = baseDelayMs * Math.pow(multiplier, attempt - 1);
        long delay = (long) Math.min(exponential, (double) maxDelayMs);
        long jitter = (long) Math.floor(random.getAsDouble() * JITTER_RATIO * delay);
        return delay + jitter;
    }

    public long calculateBackoffDelay(int attempt, long baseDelayMs, long maxDelayMs) {
        return calculateBackoffDelay(attempt, baseDelayMs, maxDelayMs, DEFAULT_MULTIPLIER);
    }
}
