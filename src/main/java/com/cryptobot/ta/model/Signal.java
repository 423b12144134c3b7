package com.cryptobot.ta.model;

import java.util.Locale;

/**
 * Label vocabulary shared by both acquisition paths. Every label maps to one direction,
 * which is what the summary tallies count.
 */
public enum Signal {
    BUY("Buy", SignalDirection.BULLISH),
    SELL("Sell", SignalDirection.BEARISH),
    NEUTRAL("Neutral", SignalDirection.NEUTRAL),
    OVERBOUGHT("Overbought", SignalDirection.BEARISH),
    OVERSOLD("Oversold", SignalDirection.BULLISH),
    ACCUMULATION("Accumulation", SignalDirection.BULLISH),
    DISTRIBUTION("Distribution", SignalDirection.BEARISH),
    HIGH_VOLATILITY("High Volatility", SignalDirection.NEUTRAL),
    LOW_VOLATILITY("Low Volatility", SignalDirection.NEUTRAL),
    BULLISH("Bullish", SignalDirection.BULLISH),
    BEARISH("Bearish", SignalDirection.BEARISH),
    BUYING_PRESSURE("Buying Pressure", SignalDirection.BULLISH),
    SELLING_PRESSURE("Selling Pressure", SignalDirection.BEARISH),
    NOT_APPLICABLE("N/A", SignalDirection.NEUTRAL);

    private final String label;
    private final SignalDirection direction;

    Signal(String label, SignalDirection direction) {
        this.label = label;
        this.direction = direction;
    }

    public String label() {
        return label;
    }

    public SignalDirection direction() {
        return direction;
    }

    public static Signal fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("signal label must not be empty");
        }
        String wanted = raw.trim().toLowerCase(Locale.ROOT);
        for (Signal signal : values()) {
            if (signal.label.toLowerCase(Locale.ROOT).equals(wanted)) {
                return signal;
            }
        }
        throw new IllegalArgumentException("unknown signal label: " + raw);
    }

    @Override
    public String toString() {
        return label;
    }
}
