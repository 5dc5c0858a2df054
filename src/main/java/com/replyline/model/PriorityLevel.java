package com.replyline.model;

/**
 * Named priority tiers. Lower value = more urgent.
 * Each tier is also a fairness lane of the dispatch queue.
 */
public enum PriorityLevel {

    CRITICAL(1),
    HIGH(20),
    NORMAL(50),
    LOW(80),
    BATCH(100);

    public static final int MIN_VALUE = 1;
    public static final int MAX_VALUE = 100;

    private final int value;

    PriorityLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Clamp an adjusted priority into [1, 100].
     */
    public static int clamp(int priority) {
        return Math.max(MIN_VALUE, Math.min(MAX_VALUE, priority));
    }

    /**
     * Tier a numeric priority falls into: the first tier whose value is >= priority.
     */
    public static PriorityLevel forValue(int priority) {
        for (PriorityLevel level : values()) {
            if (priority <= level.value) {
                return level;
            }
        }
        return BATCH;
    }
}
