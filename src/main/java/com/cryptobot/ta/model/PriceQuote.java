package com.cryptobot.ta.model;

import java.time.Instant;

/**
 * Spot price and 24h market data of a symbol in USD.
 */
public final class PriceQuote {
    public final double price;
    public final double change24h;
    public final double changePercent24h;
    public final double marketCap;
    public final double volume24h;
    public final Instant asOf;

    public PriceQuote(double price, double change24h, double changePercent24h, double marketCap, double volume24h, Instant asOf) {
        this.price = price;
        this.change24h = change24h;
        this.changePercent24h = changePercent24h;
        this.marketCap = marketCap;
        this.volume24h = volume24h;
        this.asOf = asOf == null ? Instant.EPOCH : asOf;
    }
}
