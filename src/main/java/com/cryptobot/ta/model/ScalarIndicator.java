package com.cryptobot.ta.model;

public final class ScalarIndicator extends IndicatorResult {
    private final double value;

    public ScalarIndicator(IndicatorType type, double value, Signal signal) {
        super(type, signal, IndicatorKind.SCALAR);
        this.value = value;
    }

    public double value() {
        return value;
    }

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.SCALAR;
    }
}
