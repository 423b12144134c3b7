package com.cryptobot.ta.runner;

import java.util.Locale;

public enum AcquisitionMode {
    /** Pre-computed indicators from the remote indicator API. */
    REMOTE,
    /** Indicators computed here from OHLC candles. */
    LOCAL;

    public static AcquisitionMode parse(String raw) {
        String value = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        if (value.isEmpty()) {
            return REMOTE;
        }
        try {
            return valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("mode must be local or remote, got: " + raw, e);
        }
    }
}
