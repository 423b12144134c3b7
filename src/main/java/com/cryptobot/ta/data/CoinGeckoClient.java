package com.cryptobot.ta.data;

import com.cryptobot.data.http.HttpClientEx;
import com.cryptobot.data.http.HttpStatusException;
import com.cryptobot.ta.config.Config;
import com.cryptobot.ta.config.CryptoRegistry;
import com.cryptobot.ta.error.TechnicalAnalysisException;
import com.cryptobot.ta.model.Candle;
import com.cryptobot.ta.model.CryptoAsset;
import com.cryptobot.ta.model.PriceQuote;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * CoinGecko public API: spot price with 24h market data and OHLC candles in USD.
 */
public final class CoinGeckoClient implements PriceSource, OhlcSource {
    private static final Logger log = LogManager.getLogger(CoinGeckoClient.class);

    private final HttpClientEx http;
    private final CryptoRegistry registry;
    private final String baseUrl;
    private final String apiKey;
    private final int timeoutSec;

    public CoinGeckoClient(Config config, HttpClientEx http, CryptoRegistry registry) {
        this(
                http,
                registry,
                config.getString("coingecko.base_url", "https://api.coingecko.com/api/v3"),
                config.getString("coingecko.api_key", ""),
                Math.max(5, config.getInt("coingecko.request_timeout_sec", 30))
        );
    }

    public CoinGeckoClient(HttpClientEx http, CryptoRegistry registry, String baseUrl, String apiKey, int timeoutSec) {
        this.http = http;
        this.registry = registry;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.timeoutSec = timeoutSec;
    }

    @Override
    public PriceQuote getPrice(String symbol) {
        CryptoAsset asset = registry.require(symbol);
        String url = baseUrl + "/simple/price?ids=" + encode(asset.coingeckoId)
                + "&vs_currencies=usd"
                + "&include_market_cap=true"
                + "&include_24hr_vol=true"
                + "&include_24hr_change=true"
                + "&include_last_updated_at=true";
        String body = get(url, "price " + asset.symbol);
        try {
            JSONObject root = new JSONObject(body);
            JSONObject data = root.optJSONObject(asset.coingeckoId);
            if (data == null || !data.has("usd")) {
                throw new TechnicalAnalysisException("no price data for " + asset.symbol);
            }
            double price = data.getDouble("usd");
            double changePct = data.optDouble("usd_24h_change", 0.0);
            double previous = changePct <= -100.0 ? price : price / (1.0 + changePct / 100.0);
            long updatedAt = data.optLong("last_updated_at", 0L);
            return new PriceQuote(
                    price,
                    price - previous,
                    changePct,
                    data.optDouble("usd_market_cap", 0.0),
                    data.optDouble("usd_24h_vol", 0.0),
                    updatedAt > 0L ? Instant.ofEpochSecond(updatedAt) : Instant.EPOCH
            );
        } catch (JSONException e) {
            throw new TechnicalAnalysisException("malformed price response for " + asset.symbol, e);
        }
    }

    @Override
    public List<Candle> getOhlc(String symbol, int days) {
        if (!VALID_DAYS.contains(days)) {
            throw new IllegalArgumentException("days must be one of " + VALID_DAYS + ", got " + days);
        }
        CryptoAsset asset = registry.require(symbol);
        String url = baseUrl + "/coins/" + encode(asset.coingeckoId) + "/ohlc?vs_currency=usd&days=" + days;
        String body = get(url, "ohlc " + asset.symbol);
        List<Candle> candles = new ArrayList<>();
        try {
            JSONArray rows = new JSONArray(body);
            for (int i = 0; i < rows.length(); i++) {
                JSONArray row = rows.optJSONArray(i);
                if (row == null || row.length() < 5) {
                    continue;
                }
                candles.add(new Candle(
                        row.getLong(0),
                        row.getDouble(1),
                        row.getDouble(2),
                        row.getDouble(3),
                        row.getDouble(4)
                ));
            }
        } catch (JSONException e) {
            throw new TechnicalAnalysisException("malformed OHLC response for " + asset.symbol, e);
        }
        candles.sort(Comparator.comparingLong(c -> c.timestamp));
        log.debug("{}: {} candles for {} days", asset.symbol, candles.size(), days);
        return candles;
    }

    private String get(String url, String what) {
        Map<String, String> headers = apiKey.isEmpty() ? Map.of() : Map.of("x-cg-demo-api-key", apiKey);
        try {
            return http.getText(url, timeoutSec, headers);
        } catch (HttpStatusException | IOException e) {
            throw new TechnicalAnalysisException("coingecko " + what + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TechnicalAnalysisException("coingecko " + what + " interrupted", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
