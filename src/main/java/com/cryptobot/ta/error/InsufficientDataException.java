package com.cryptobot.ta.error;

public class InsufficientDataException extends TechnicalAnalysisException {
    private final int required;
    private final int actual;

    public InsufficientDataException(int required, int actual) {
        super("Insufficient data: need at least " + required + " candles, got " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }
}
