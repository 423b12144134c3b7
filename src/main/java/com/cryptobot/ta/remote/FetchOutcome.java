package com.cryptobot.ta.remote;

import org.json.JSONObject;

/**
 * Result of the last attempt for one indicator key.
 */
public final class FetchOutcome {
    public final String key;
    public final boolean success;
    public final JSONObject payload;
    public final String error;
    public final String errorCategory;
    public final int attempts;

    private FetchOutcome(String key, boolean success, JSONObject payload, String error, String errorCategory, int attempts) {
        this.key = key;
        this.success = success;
        this.payload = payload;
        this.error = error == null ? "" : error;
        this.errorCategory = errorCategory == null ? "" : errorCategory;
        this.attempts = Math.max(0, attempts);
    }

    public static FetchOutcome success(String key, JSONObject payload, int attempts) {
        return new FetchOutcome(key, true, payload, "", "", attempts);
    }

    public static FetchOutcome failure(String key, String error, String errorCategory, int attempts) {
        return new FetchOutcome(key, false, null, error, errorCategory, attempts);
    }

    static FetchOutcome notAttempted(String key) {
        return new FetchOutcome(key, false, null, "not attempted", "other", 0);
    }
}
