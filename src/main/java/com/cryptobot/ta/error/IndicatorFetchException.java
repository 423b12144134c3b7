package com.cryptobot.ta.error;

import org.json.JSONException;

import java.net.http.HttpTimeoutException;
import java.util.Locale;

/**
 * Failure to fetch a single indicator. Recoverable: the orchestrator records it and
 * retries the key in a later round.
 */
public class IndicatorFetchException extends TechnicalAnalysisException {
    public static final String TIMEOUT = "timeout";
    public static final String RATE_LIMIT = "rate_limit";
    public static final String HTTP = "http";
    public static final String PARSE = "parse";
    public static final String EMPTY = "empty";
    public static final String OTHER = "other";

    private final String key;
    private final String category;

    public IndicatorFetchException(String key, String category, String message) {
        super(message);
        this.key = key == null ? "" : key;
        this.category = category == null ? OTHER : category;
    }

    public IndicatorFetchException(String key, String category, String message, Throwable cause) {
        super(message, cause);
        this.key = key == null ? "" : key;
        this.category = category == null ? OTHER : category;
    }

    public String key() {
        return key;
    }

    public String category() {
        return category;
    }

    /**
     * Maps a raw failure message onto a category, the same buckets the price
     * fetchers report.
     */
    public static String classify(Throwable error) {
        if (error instanceof IndicatorFetchException fetch) {
            return fetch.category();
        }
        if (error instanceof HttpTimeoutException) {
            return TIMEOUT;
        }
        String message = error == null || error.getMessage() == null
                ? ""
                : error.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("timed out") || message.contains("timeout")) {
            return TIMEOUT;
        }
        if (message.contains("429") || message.contains("too many requests") || message.contains("rate limit")) {
            return RATE_LIMIT;
        }
        if (message.contains("http ")) {
            return HTTP;
        }
        if (error instanceof JSONException) {
            return PARSE;
        }
        return OTHER;
    }
}
