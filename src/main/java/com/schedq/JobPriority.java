package com.schedq;

/**
 * Named priority levels. Any integer in [{@link #LOW}, {@link #CRITICAL}] is accepted on a job.
 */
public enum JobPriority {
    LOW(1),
    NORMAL(5),
    HIGH(10),
    CRITICAL(15);

    private final int value;

    JobPriority(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static boolean isInRange(int priority) {
        return priority >= LOW.value && priority <= CRITICAL.value;
    }
}
