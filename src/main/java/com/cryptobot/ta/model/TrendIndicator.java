package com.cryptobot.ta.model;

import java.util.Objects;

public final class TrendIndicator extends IndicatorResult {
    public static final String NOT_APPLICABLE = "N/A";

    private final double value;
    private final String trend;

    public TrendIndicator(IndicatorType type, double value, String trend, Signal signal) {
        super(type, signal, IndicatorKind.TREND);
        this.value = value;
        this.trend = Objects.requireNonNull(trend, "trend");
    }

    /**
     * Marker for a trend indicator that cannot be produced by the current path.
     * It is not a real value: the value is NaN and signal and trend read "N/A".
     */
    public static TrendIndicator notApplicable(IndicatorType type) {
        return new TrendIndicator(type, Double.NaN, NOT_APPLICABLE, Signal.NOT_APPLICABLE);
    }

    public boolean notApplicable() {
        return signal() == Signal.NOT_APPLICABLE;
    }

    public double value() {
        return value;
    }

    public String trend() {
        return trend;
    }

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.TREND;
    }
}
