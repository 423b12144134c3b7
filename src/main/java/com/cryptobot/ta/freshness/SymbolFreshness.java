package com.cryptobot.ta.freshness;

import org.json.JSONObject;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Age of the newest stored record for one symbol. {@code age} and {@code scrapedAt} are null
 * for {@link FreshnessStatus#NO_DATA} and {@link FreshnessStatus#ERROR}.
 */
public record SymbolFreshness(
        String symbol,
        FreshnessStatus status,
        Duration age,
        Instant scrapedAt,
        double price,
        int indicatorCount,
        String overallSummary,
        String message
) {

    static SymbolFreshness noData(String symbol) {
        return new SymbolFreshness(symbol, FreshnessStatus.NO_DATA, null, null, Double.NaN, 0, null,
                "No data found in database");
    }

    static SymbolFreshness error(String symbol, String message) {
        return new SymbolFreshness(symbol, FreshnessStatus.ERROR, null, null, Double.NaN, 0, null, message);
    }

    public double ageMinutes() {
        return age == null ? Double.NaN : age.toMillis() / 60_000.0;
    }

    public double ageHours() {
        return age == null ? Double.NaN : age.toMillis() / 3_600_000.0;
    }

    /**
     * Minutes below one hour, hours above.
     */
    public String describeAge() {
        if (age == null) {
            return "n/a";
        }
        if (age.compareTo(Duration.ofHours(1)) < 0) {
            return String.format(Locale.ROOT, "%.1f minutes", ageMinutes());
        }
        return String.format(Locale.ROOT, "%.1f hours", ageHours());
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("symbol", symbol);
        json.put("status", status.label());
        if (age == null) {
            json.put(status == FreshnessStatus.ERROR ? "error" : "message", message);
            return json;
        }
        json.put("age_minutes", ageMinutes());
        json.put("age_hours", ageHours());
        json.put("scraped_at", scrapedAt.toString());
        json.put("price", Double.isNaN(price) ? JSONObject.NULL : price);
        json.put("indicator_count", indicatorCount);
        json.put("overall_summary", overallSummary == null ? "N/A" : overallSummary);
        return json;
    }
}
