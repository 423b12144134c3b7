package com.cryptobot.ta.model;

public final class BandIndicator extends IndicatorResult {
    private final double upper;
    private final double middle;
    private final double lower;

    public BandIndicator(IndicatorType type, double upper, double middle, double lower, Signal signal) {
        super(type, signal, IndicatorKind.BAND);
        this.upper = upper;
        this.middle = middle;
        this.lower = lower;
    }

    public double upper() {
        return upper;
    }

    public double middle() {
        return middle;
    }

    public double lower() {
        return lower;
    }

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.BAND;
    }
}
