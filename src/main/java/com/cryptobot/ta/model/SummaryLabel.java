package com.cryptobot.ta.model;

import java.util.Locale;

public enum SummaryLabel {
    STRONG_BUY("Strong Buy"),
    BUY("Buy"),
    NEUTRAL("Neutral"),
    SELL("Sell"),
    STRONG_SELL("Strong Sell");

    private final String label;

    SummaryLabel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isBullish() {
        return this == STRONG_BUY || this == BUY;
    }

    public boolean isBearish() {
        return this == STRONG_SELL || this == SELL;
    }

    public static SummaryLabel fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return NEUTRAL;
        }
        String wanted = raw.trim().toLowerCase(Locale.ROOT);
        for (SummaryLabel value : values()) {
            if (value.label.toLowerCase(Locale.ROOT).equals(wanted)) {
                return value;
            }
        }
        throw new IllegalArgumentException("unknown summary label: " + raw);
    }

    @Override
    public String toString() {
        return label;
    }
}
