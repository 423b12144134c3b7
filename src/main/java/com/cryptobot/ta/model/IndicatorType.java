package com.cryptobot.ta.model;

import java.util.List;

/**
 * The nine indicators of a record, declared in canonical output order.
 */
public enum IndicatorType {
    RSI("RSI(14)", "rsi", IndicatorKind.SCALAR),
    MACD("MACD(12,26)", "macd", IndicatorKind.MACD),
    BOLLINGER_BANDS("Bollinger Bands(20,2)", "bbands", IndicatorKind.BAND),
    OBV("OBV", "obv", IndicatorKind.SCALAR),
    STOCH_RSI("StochRSI", "stochrsi", IndicatorKind.SCALAR),
    ATR("ATR(14)", "atr", IndicatorKind.SCALAR),
    VWAP("VWAP", "vwap", IndicatorKind.SCALAR),
    SUPERTREND("SuperTrend", "supertrend", IndicatorKind.TREND),
    CMF("CMF(20)", "cmf", IndicatorKind.SCALAR);

    private static final List<IndicatorType> CANONICAL_ORDER = List.of(values());

    private final String displayName;
    private final String remoteKey;
    private final IndicatorKind kind;

    IndicatorType(String displayName, String remoteKey, IndicatorKind kind) {
        this.displayName = displayName;
        this.remoteKey = remoteKey;
        this.kind = kind;
    }

    public String displayName() {
        return displayName;
    }

    public String remoteKey() {
        return remoteKey;
    }

    public IndicatorKind kind() {
        return kind;
    }

    public static List<IndicatorType> canonicalOrder() {
        return CANONICAL_ORDER;
    }

    public static IndicatorType fromDisplayName(String name) {
        for (IndicatorType type : CANONICAL_ORDER) {
            if (type.displayName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown indicator name: " + name);
    }
}
