package com.cryptobot.ta.runner;

import com.cryptobot.ta.model.TechnicalAnalysisRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class BatchResult {
    public final List<TechnicalAnalysisRecord> records;
    public final Map<String, String> failures;
    public final int persisted;
    public final int persistFailures;

    BatchResult(List<TechnicalAnalysisRecord> records, Map<String, String> failures, int persisted, int persistFailures) {
        this.records = List.copyOf(records);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.persisted = persisted;
        this.persistFailures = persistFailures;
    }

    public boolean allSucceeded() {
        return failures.isEmpty();
    }
}
