package com.cryptobot.ta.error;

public class PersistException extends TechnicalAnalysisException {
    public PersistException(String message, Throwable cause) {
        super(message, cause);
    }
}
