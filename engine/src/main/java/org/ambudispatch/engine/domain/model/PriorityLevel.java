package org.ambudispatch.engine.domain.model;

/**
 * Call priority, highest first. The rank gives the total order used by the
 * call queue: a higher rank is served before a lower one.
 */
public enum PriorityLevel {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    PriorityLevel(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isAtLeast(PriorityLevel other) {
        return rank >= other.rank;
    }

    /**
     * Maps the numeric code of a priority table (1 = most urgent) to a level.
     * Codes of 4 and above all fall into {@link #LOW}.
     */
    public static PriorityLevel fromCode(int code) {
        if (code < 1) {
            throw new IllegalArgumentException("Priority code must be at least 1: " + code);
        }
        switch (code) {
            case 1:
                return CRITICAL;
            case 2:
                return HIGH;
            case 3:
                return MEDIUM;
            default:
                return LOW;
        }
    }
}
