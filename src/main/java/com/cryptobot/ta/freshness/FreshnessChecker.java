package com.cryptobot.ta.freshness;

import com.cryptobot.ta.config.Config;
import com.cryptobot.ta.db.TechnicalAnalysisStore;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reports how old the newest stored record of each symbol is.
 */
public final class FreshnessChecker {
    private static final Logger log = LogManager.getLogger(FreshnessChecker.class);

    private final TechnicalAnalysisStore store;
    private final Clock clock;
    private final Duration freshWithin;
    private final Duration acceptableWithin;

    public FreshnessChecker(TechnicalAnalysisStore store, Clock clock, Duration freshWithin, Duration acceptableWithin) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (freshWithin.isNegative() || freshWithin.isZero()) {
            throw new IllegalArgumentException("fresh threshold must be positive: " + freshWithin);
        }
        if (acceptableWithin.compareTo(freshWithin) < 0) {
            throw new IllegalArgumentException("acceptable threshold " + acceptableWithin
                    + " is below fresh threshold " + freshWithin);
        }
        this.freshWithin = freshWithin;
        this.acceptableWithin = acceptableWithin;
    }

    public static FreshnessChecker fromConfig(Config config, TechnicalAnalysisStore store, Clock clock) {
        return new FreshnessChecker(
                store,
                clock,
                Duration.ofMinutes(config.getInt("freshness.fresh_minutes", 60)),
                Duration.ofMinutes(config.getInt("freshness.acceptable_minutes", 120))
        );
    }

    public SymbolFreshness check(String symbol) {
        String normalized = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("symbol must not be empty");
        }
        List<TechnicalAnalysisRecord> latest;
        try {
            latest = store.latest(normalized, 1);
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("{}: freshness lookup failed: {}", normalized, message);
            return SymbolFreshness.error(normalized, message);
        }
        if (latest.isEmpty()) {
            return SymbolFreshness.noData(normalized);
        }
        TechnicalAnalysisRecord record = latest.get(0);
        Duration age = Duration.between(record.scrapedAt, Instant.now(clock));
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        FreshnessStatus status = FreshnessStatus.ofAge(age, freshWithin, acceptableWithin);
        return new SymbolFreshness(
                normalized,
                status,
                age,
                record.scrapedAt,
                record.price,
                record.technicalIndicators.size(),
                record.summary.overall().label(),
                null
        );
    }

    public List<SymbolFreshness> checkAll(List<String> symbols) {
        List<SymbolFreshness> out = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            out.add(check(symbol));
        }
        return out;
    }
}
