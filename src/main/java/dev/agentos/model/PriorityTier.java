package dev.agentos.model;

import java.util.Locale;

/**
 * Scheduling priority of an agent. Lower rank wins ties and write conflicts.
 */
public enum PriorityTier {
    HIGH(0),
    NORMAL(1),
    LOW(2);

    private final int rank;

    PriorityTier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean outranks(PriorityTier other) {
        return rank < other.rank;
    }

    /**
     * Parse a manifest value such as {@code high} or {@code Normal}.
     *
     * @throws IllegalArgumentException if the value is not a known tier
     */
    public static PriorityTier parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
