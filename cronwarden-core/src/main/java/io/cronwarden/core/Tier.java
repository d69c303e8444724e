package io.cronwarden.core;

/**
 * Quality check cadence tiers.
 */
public enum Tier {
    FAST(1, "0 * * * *"),
    DEEP(2, "0 3 * * *"),
    AUDIT(3, "0 4 * * 0");

    private final int value;
    private final String defaultSchedule;

    Tier(int value, String defaultSchedule) {
        this.value = value;
        this.defaultSchedule = defaultSchedule;
    }

    public int value() {
        return value;
    }

    public String defaultSchedule() {
        return defaultSchedule;
    }

    public static Tier of(int value) {
        for (Tier t : values()) {
            if (t.value == value) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown tier: " + value);
    }
}
