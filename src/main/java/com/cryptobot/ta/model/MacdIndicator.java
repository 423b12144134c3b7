package com.cryptobot.ta.model;

public final class MacdIndicator extends IndicatorResult {
    private final double value;
    private final double histogram;

    public MacdIndicator(IndicatorType type, double value, double histogram, Signal signal) {
        super(type, signal, IndicatorKind.MACD);
        this.value = value;
        this.histogram = histogram;
    }

    public double value() {
        return value;
    }

    public double histogram() {
        return histogram;
    }

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.MACD;
    }
}
