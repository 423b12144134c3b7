package com.cryptobot.ta.summary;

import com.cryptobot.ta.model.Signal;
import com.cryptobot.ta.model.SignalDirection;

/**
 * Which labels count as votes. {@link #LITERAL} only counts {@code Buy} and {@code Sell};
 * {@link #DIRECTION} also counts zone and pressure labels by their direction.
 * Labels that are not votes still count toward the total.
 */
public enum VoteCounting {
    LITERAL("literal"),
    DIRECTION("direction");

    private final String label;

    VoteCounting(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isBuy(Signal signal) {
        if (this == LITERAL) {
            return signal == Signal.BUY;
        }
        return signal.direction() == SignalDirection.BULLISH;
    }

    public boolean isSell(Signal signal) {
        if (this == LITERAL) {
            return signal == Signal.SELL;
        }
        return signal.direction() == SignalDirection.BEARISH;
    }
}
