package com.cryptobot.utils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Wall-clock durations of named steps, in start order.
 */
public class StepTimer {
    private final Map<String, Long> start = new LinkedHashMap<>();
    private final Map<String, Long> durMs = new LinkedHashMap<>();

    public void start(String step) {
        start.put(step, System.currentTimeMillis());
    }

    public void end(String step) {
        Long s = start.get(step);
        if (s != null) {
            durMs.merge(step, System.currentTimeMillis() - s, Long::sum);
        }
    }

    public Map<String, Long> snapshot() { return new LinkedHashMap<>(durMs); }

    public String summaryText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Step timings");
        for (Map.Entry<String, Long> e : durMs.entrySet()) {
            sb.append(" | ").append(stepLabel(e.getKey())).append('=').append(e.getValue()).append("ms");
        }
        return sb.toString();
    }

    private static String stepLabel(String step) {
        if (step == null) return "";
        switch (step) {
            case "TOTAL":
                return "total";
            case "DB_INIT":
                return "db init";
            case "FETCH":
                return "fetch";
            case "ANALYZE":
                return "analyze";
            case "DB_WRITE":
                return "db write";
            case "OUTPUT":
                return "output";
            default:
                return step.toLowerCase(Locale.ROOT);
        }
    }
}
