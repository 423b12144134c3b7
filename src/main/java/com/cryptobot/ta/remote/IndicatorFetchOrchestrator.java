package com.cryptobot.ta.remote;

import com.cryptobot.ta.error.IndicatorFetchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pulls a list of indicators one by one through a {@link RateLimiter}, then re-fetches the
 * missing ones in fixed-delay rounds. Partial data is accepted on the last round; a failed
 * key never aborts the cycle and a successful key is never requested twice.
 */
public final class IndicatorFetchOrchestrator {
    private static final Logger log = LogManager.getLogger(IndicatorFetchOrchestrator.class);

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(30);

    private final RemoteIndicatorSource source;
    private final RateLimiter rateLimiter;
    private final MonotonicClock clock;
    private final int maxRetries;
    private final Duration retryDelay;

    public IndicatorFetchOrchestrator(
            RemoteIndicatorSource source,
            RateLimiter rateLimiter,
            MonotonicClock clock,
            int maxRetries,
            Duration retryDelay
    ) {
        this.source = Objects.requireNonNull(source, "source");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxRetries = Math.max(0, maxRetries);
        this.retryDelay = retryDelay == null || retryDelay.isNegative() ? Duration.ZERO : retryDelay;
    }

    public FetchReport fetchAll(FetchTarget target, List<IndicatorSpec> specs) {
        Map<String, FetchOutcome> outcomes = new LinkedHashMap<>();
        for (IndicatorSpec spec : specs) {
            if (outcomes.containsKey(spec.key())) {
                throw new IllegalArgumentException("duplicate indicator key: " + spec.key());
            }
            outcomes.put(spec.key(), FetchOutcome.notAttempted(spec.key()));
        }
        Cycle cycle = new Cycle(target, outcomes);
        int rounds = 0;
        boolean interrupted = false;

        try {
            for (IndicatorSpec spec : specs) {
                fetchOne(cycle, spec);
            }
            for (int round = 1; round <= maxRetries; round++) {
                List<IndicatorSpec> missing = missing(specs, outcomes);
                if (missing.isEmpty()) {
                    break;
                }
                if (round == maxRetries) {
                    log.warn("{}: accepting partial data, still missing {} after {} retry rounds",
                            target.symbolPair(), keys(missing), round - 1);
                    break;
                }
                rounds = round;
                log.info("{}: retry round {}/{} for {} in {}s",
                        target.symbolPair(), round, maxRetries, keys(missing), retryDelay.toSeconds());
                if (!retryDelay.isZero()) {
                    clock.sleep(retryDelay);
                }
                for (IndicatorSpec spec : missing) {
                    fetchOne(cycle, spec);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
            log.warn("{}: fetch interrupted, keeping {} collected indicators",
                    target.symbolPair(), countSuccess(outcomes));
        }

        FetchReport report = new FetchReport(outcomes, cycle.attempts, rounds, interrupted);
        log.info("{}: fetched {}/{} indicators in {} requests",
                target.symbolPair(), report.successCount(), report.requested(), report.attempts);
        return report;
    }

    private void fetchOne(Cycle cycle, IndicatorSpec spec) throws InterruptedException {
        FetchTarget target = cycle.target;
        Map<String, FetchOutcome> outcomes = cycle.outcomes;
        rateLimiter.waitForSlot();
        cycle.attempts++;
        int keyAttempts = cycle.attemptsByKey.merge(spec.key(), 1, Integer::sum);
        try {
            JSONObject payload = source.fetch(spec, target);
            if (payload == null || payload.isEmpty()) {
                throw new IndicatorFetchException(spec.key(), IndicatorFetchException.EMPTY, "empty response");
            }
            outcomes.put(spec.key(), FetchOutcome.success(spec.key(), payload, keyAttempts));
            log.debug("{}: {} ok", target.symbolPair(), spec.key());
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            String category = IndicatorFetchException.classify(e);
            outcomes.put(spec.key(), FetchOutcome.failure(spec.key(), message, category, keyAttempts));
            log.warn("{}: {} failed ({}): {}", target.symbolPair(), spec.key(), category, message);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("interrupted while fetching " + spec.key());
        }
    }

    private static List<IndicatorSpec> missing(List<IndicatorSpec> specs, Map<String, FetchOutcome> outcomes) {
        List<IndicatorSpec> out = new ArrayList<>();
        for (IndicatorSpec spec : specs) {
            if (!outcomes.get(spec.key()).success) {
                out.add(spec);
            }
        }
        return out;
    }

    private static List<String> keys(List<IndicatorSpec> specs) {
        List<String> out = new ArrayList<>(specs.size());
        for (IndicatorSpec spec : specs) {
            out.add(spec.key());
        }
        return out;
    }

    private static int countSuccess(Map<String, FetchOutcome> outcomes) {
        int count = 0;
        for (FetchOutcome outcome : outcomes.values()) {
            if (outcome.success) {
                count++;
            }
        }
        return count;
    }

    private static final class Cycle {
        private final FetchTarget target;
        private final Map<String, FetchOutcome> outcomes;
        private final Map<String, Integer> attemptsByKey = new HashMap<>();
        private int attempts;

        private Cycle(FetchTarget target, Map<String, FetchOutcome> outcomes) {
            this.target = target;
            this.outcomes = outcomes;
        }
    }
}
