package com.cryptobot.ta.remote;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One remote indicator request. {@code key} identifies the result, {@code indicator} is the
 * endpoint name, {@code params} are extra query parameters.
 */
public record IndicatorSpec(String key, String indicator, Map<String, String> params) {
    public IndicatorSpec {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(indicator, "indicator");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static IndicatorSpec of(String key, String indicator) {
        return new IndicatorSpec(key, indicator, Map.of());
    }

    public static IndicatorSpec of(String key, String indicator, String paramName, String paramValue) {
        return new IndicatorSpec(key, indicator, Map.of(paramName, paramValue));
    }

    public static IndicatorSpec price() {
        return of("price", "price");
    }

    public static List<IndicatorSpec> defaults() {
        Map<String, String> bbands = new LinkedHashMap<>();
        bbands.put("period", "20");
        bbands.put("stddev", "2");
        return List.of(
                of("rsi", "rsi", "period", "14"),
                of("macd", "macd"),
                new IndicatorSpec("bbands", "bbands", bbands),
                of("obv", "obv"),
                of("stochrsi", "stochrsi"),
                of("atr", "atr", "period", "14"),
                of("vwap", "vwap"),
                of("supertrend", "supertrend"),
                of("cmf", "cmf", "period", "20"),
                of("ema20", "ema", "period", "20"),
                of("ema50", "ema", "period", "50"),
                of("ema200", "ema", "period", "200")
        );
    }
}
