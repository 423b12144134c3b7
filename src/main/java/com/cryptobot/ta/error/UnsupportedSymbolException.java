package com.cryptobot.ta.error;

public class UnsupportedSymbolException extends TechnicalAnalysisException {
    private final String symbol;

    public UnsupportedSymbolException(String symbol) {
        super("Unsupported symbol: " + symbol);
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
