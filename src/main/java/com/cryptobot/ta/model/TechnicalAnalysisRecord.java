package com.cryptobot.ta.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical technical-analysis snapshot of one symbol. Both acquisition paths end in
 * this shape. Lists and metadata are copied on construction and exposed read-only.
 */
public final class TechnicalAnalysisRecord {
    public final String symbol;
    public final double price;
    public final double priceChange;
    public final double priceChangePercent;
    public final SummaryTriplet summary;
    public final List<IndicatorResult> technicalIndicators;
    public final List<MovingAverageResult> movingAverages;
    public final List<PivotSet> pivotPoints;
    public final String sourceUrl;
    public final Instant scrapedAt;
    public final Map<String, Object> metadata;

    public TechnicalAnalysisRecord(
            String symbol,
            double price,
            double priceChange,
            double priceChangePercent,
            SummaryTriplet summary,
            List<IndicatorResult> technicalIndicators,
            List<MovingAverageResult> movingAverages,
            List<PivotSet> pivotPoints,
            String sourceUrl,
            Instant scrapedAt,
            Map<String, Object> metadata
    ) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.price = price;
        this.priceChange = priceChange;
        this.priceChangePercent = priceChangePercent;
        this.summary = Objects.requireNonNull(summary, "summary");
        this.technicalIndicators = technicalIndicators == null ? List.of() : List.copyOf(technicalIndicators);
        this.movingAverages = movingAverages == null ? List.of() : List.copyOf(movingAverages);
        this.pivotPoints = pivotPoints == null ? List.of() : List.copyOf(pivotPoints);
        this.sourceUrl = sourceUrl == null ? "" : sourceUrl;
        this.scrapedAt = Objects.requireNonNull(scrapedAt, "scrapedAt");
        this.metadata = freezeMap(metadata);
    }

    public IndicatorResult indicator(IndicatorType type) {
        for (IndicatorResult result : technicalIndicators) {
            if (result.type() == type) {
                return result;
            }
        }
        return null;
    }

    public MovingAverageResult movingAverage(int period) {
        for (MovingAverageResult ma : movingAverages) {
            if (ma.period == period) {
                return ma;
            }
        }
        return null;
    }

    public List<String> errors() {
        Object raw = metadata.get("errors");
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<String> out = new ArrayList<>(list.size());
        for (Object item : list) {
            out.add(String.valueOf(item));
        }
        return Collections.unmodifiableList(out);
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            out.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(freeze(item));
            }
            return Collections.unmodifiableList(out);
        }
        return value;
    }
}
