package com.cryptobot.ta.model;

import java.util.Locale;

public final class CryptoAsset {
    public final String symbol;
    public final String name;
    public final String coingeckoId;

    public CryptoAsset(String symbol, String name, String coingeckoId) {
        this.symbol = symbol.trim().toUpperCase(Locale.ROOT);
        this.name = name;
        this.coingeckoId = coingeckoId.trim().toLowerCase(Locale.ROOT);
    }

    public String usdtPair() {
        return symbol + "/USDT";
    }
}
