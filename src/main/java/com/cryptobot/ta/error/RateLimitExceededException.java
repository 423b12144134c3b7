package com.cryptobot.ta.error;

/**
 * The remote API answered HTTP 429. Treated like any other fetch failure.
 */
public class RateLimitExceededException extends IndicatorFetchException {
    public RateLimitExceededException(String key, String message) {
        super(key, RATE_LIMIT, message);
    }
}
