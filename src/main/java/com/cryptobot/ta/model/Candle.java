package com.cryptobot.ta.model;

/**
 * One OHLC candle as delivered by the candle source. Timestamps are epoch milliseconds.
 * There is no volume field: sources like CoinGecko's OHLC endpoint do not carry one.
 */
public final class Candle {
    public final long timestamp;
    public final double open;
    public final double high;
    public final double low;
    public final double close;

    public Candle(long timestamp, double open, double high, double low, double close) {
        this.timestamp = timestamp;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
    }

    public double range() {
        return high - low;
    }

    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }
}
