package com.cryptobot.ta.remote;

import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one orchestrated fetch cycle, keyed in request order.
 */
public final class FetchReport {
    public final Map<String, FetchOutcome> outcomes;
    public final int attempts;
    public final int roundsExecuted;
    public final boolean interrupted;

    FetchReport(Map<String, FetchOutcome> outcomes, int attempts, int roundsExecuted, boolean interrupted) {
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.attempts = attempts;
        this.roundsExecuted = roundsExecuted;
        this.interrupted = interrupted;
    }

    public int requested() {
        return outcomes.size();
    }

    public int successCount() {
        int count = 0;
        for (FetchOutcome outcome : outcomes.values()) {
            if (outcome.success) {
                count++;
            }
        }
        return count;
    }

    public double successRatio() {
        if (outcomes.isEmpty()) {
            return 0.0;
        }
        return (double) successCount() / outcomes.size();
    }

    public JSONObject payload(String key) {
        FetchOutcome outcome = outcomes.get(key);
        return outcome == null || !outcome.success ? null : outcome.payload;
    }

    public Map<String, String> errors() {
        Map<String, String> out = new LinkedHashMap<>();
        for (FetchOutcome outcome : outcomes.values()) {
            if (!outcome.success) {
                out.put(outcome.key, outcome.error);
            }
        }
        return out;
    }
}
