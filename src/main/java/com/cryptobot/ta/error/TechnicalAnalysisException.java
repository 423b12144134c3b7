package com.cryptobot.ta.error;

/**
 * Base of every failure raised by the technical-analysis pipeline.
 */
public class TechnicalAnalysisException extends RuntimeException {
    public TechnicalAnalysisException(String message) {
        super(message);
    }

    public TechnicalAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
