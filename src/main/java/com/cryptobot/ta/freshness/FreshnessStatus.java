package com.cryptobot.ta.freshness;

import java.time.Duration;

public enum FreshnessStatus {
    FRESH("fresh"),
    ACCEPTABLE("acceptable"),
    STALE("stale"),
    NO_DATA("no_data"),
    ERROR("error");

    private final String label;

    FreshnessStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Strictly younger than {@code freshWithin} is fresh, younger than {@code acceptableWithin} is acceptable.
     */
    public static FreshnessStatus ofAge(Duration age, Duration freshWithin, Duration acceptableWithin) {
        if (age.compareTo(freshWithin) < 0) {
            return FRESH;
        }
        if (age.compareTo(acceptableWithin) < 0) {
            return ACCEPTABLE;
        }
        return STALE;
    }

    public boolean isUsable() {
        return this == FRESH || this == ACCEPTABLE;
    }
}
