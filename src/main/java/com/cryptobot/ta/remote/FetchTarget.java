package com.cryptobot.ta.remote;

import java.util.Objects;

public record FetchTarget(String symbolPair, String exchange, String interval) {
    public FetchTarget {
        Objects.requireNonNull(symbolPair, "symbolPair");
        exchange = exchange == null || exchange.isBlank() ? "binance" : exchange.trim();
        interval = interval == null || interval.isBlank() ? "1h" : interval.trim();
    }
}
