package com.cryptobot.ta.config;

import com.cryptobot.ta.error.UnsupportedSymbolException;
import com.cryptobot.ta.model.CryptoAsset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Supported crypto assets and their CoinGecko ids.
 */
public final class CryptoRegistry {
    private static final List<CryptoAsset> KNOWN = List.of(
            new CryptoAsset("BTC", "Bitcoin", "bitcoin"),
            new CryptoAsset("ETH", "Ethereum", "ethereum"),
            new CryptoAsset("ADA", "Cardano", "cardano"),
            new CryptoAsset("SOL", "Solana", "solana"),
            new CryptoAsset("DOT", "Polkadot", "polkadot"),
            new CryptoAsset("LINK", "Chainlink", "chainlink"),
            new CryptoAsset("MATIC", "Polygon", "matic-network"),
            new CryptoAsset("LTC", "Litecoin", "litecoin"),
            new CryptoAsset("XRP", "XRP", "ripple"),
            new CryptoAsset("DOGE", "Dogecoin", "dogecoin")
    );

    private final Map<String, CryptoAsset> bySymbol;
    private final Map<String, CryptoAsset> byId;

    private CryptoRegistry(List<CryptoAsset> assets) {
        Map<String, CryptoAsset> symbols = new LinkedHashMap<>();
        Map<String, CryptoAsset> ids = new LinkedHashMap<>();
        for (CryptoAsset asset : assets) {
            symbols.put(asset.symbol, asset);
            ids.put(asset.coingeckoId, asset);
        }
        this.bySymbol = Collections.unmodifiableMap(symbols);
        this.byId = Collections.unmodifiableMap(ids);
    }

    public static CryptoRegistry defaults() {
        return new CryptoRegistry(KNOWN);
    }

    public List<CryptoAsset> all() {
        return new ArrayList<>(bySymbol.values());
    }

    public boolean isSupported(String symbolOrId) {
        return find(symbolOrId) != null;
    }

    /**
     * Looks up by ticker symbol first, then by CoinGecko id. Case-insensitive.
     */
    public CryptoAsset find(String symbolOrId) {
        if (symbolOrId == null || symbolOrId.isBlank()) {
            return null;
        }
        String key = symbolOrId.trim();
        CryptoAsset asset = bySymbol.get(key.toUpperCase(Locale.ROOT));
        if (asset != null) {
            return asset;
        }
        return byId.get(key.toLowerCase(Locale.ROOT));
    }

    public CryptoAsset require(String symbolOrId) {
        CryptoAsset asset = find(symbolOrId);
        if (asset == null) {
            throw new UnsupportedSymbolException(symbolOrId);
        }
        return asset;
    }

    /**
     * Resolves the configured symbol list. Unknown entries are rejected up front so a batch
     * never starts a network call for a symbol it cannot map.
     */
    public List<CryptoAsset> resolve(List<String> symbols) {
        List<CryptoAsset> out = new ArrayList<>();
        for (String symbol : symbols) {
            CryptoAsset asset = require(symbol);
            if (!out.contains(asset)) {
                out.add(asset);
            }
        }
        return out;
    }
}
