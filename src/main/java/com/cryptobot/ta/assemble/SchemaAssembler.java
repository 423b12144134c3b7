package com.cryptobot.ta.assemble;

import com.cryptobot.ta.model.IndicatorResult;
import com.cryptobot.ta.model.IndicatorType;
import com.cryptobot.ta.model.MovingAverageResult;
import com.cryptobot.ta.model.PivotSet;
import com.cryptobot.ta.model.PivotType;
import com.cryptobot.ta.model.SummaryTriplet;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges the parts of an analysis into a {@link TechnicalAnalysisRecord}: sorts entries into
 * canonical order, rejects duplicates and stamps the capture time.
 */
public final class SchemaAssembler {
    private final Clock clock;

    public SchemaAssembler() {
        this(Clock.systemUTC());
    }

    public SchemaAssembler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TechnicalAnalysisRecord assemble(
            String symbol,
            PriceFields price,
            List<IndicatorResult> indicators,
            List<MovingAverageResult> movingAverages,
            List<PivotSet> pivots,
            SummaryTriplet summary,
            String sourceUrl,
            Map<String, Object> metadata
    ) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        Instant scrapedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        return new TechnicalAnalysisRecord(
                symbol.trim().toUpperCase(Locale.ROOT),
                price.price(),
                price.change(),
                price.changePercent(),
                summary == null ? SummaryTriplet.neutral() : summary,
                sortIndicators(indicators),
                sortMovingAverages(movingAverages),
                sortPivots(pivots),
                sourceUrl,
                scrapedAt,
                metadata
        );
    }

    static List<IndicatorResult> sortIndicators(List<IndicatorResult> indicators) {
        if (indicators == null) {
            return List.of();
        }
        Set<IndicatorType> seen = EnumSet.noneOf(IndicatorType.class);
        for (IndicatorResult result : indicators) {
            if (!seen.add(result.type())) {
                throw new IllegalArgumentException("duplicate indicator: " + result.name());
            }
        }
        List<IndicatorResult> out = new ArrayList<>(indicators);
        out.sort(Comparator.comparingInt(result -> result.type().ordinal()));
        return out;
    }

    static List<MovingAverageResult> sortMovingAverages(List<MovingAverageResult> movingAverages) {
        if (movingAverages == null) {
            return List.of();
        }
        Set<Integer> seen = new HashSet<>();
        for (MovingAverageResult ma : movingAverages) {
            if (!seen.add(ma.period)) {
                throw new IllegalArgumentException("duplicate moving average: " + ma.name());
            }
        }
        List<MovingAverageResult> out = new ArrayList<>(movingAverages);
        out.sort(Comparator.comparingInt(ma -> ma.period));
        return out;
    }

    static List<PivotSet> sortPivots(List<PivotSet> pivots) {
        if (pivots == null) {
            return List.of();
        }
        Set<PivotType> seen = EnumSet.noneOf(PivotType.class);
        for (PivotSet pivot : pivots) {
            if (!seen.add(pivot.type)) {
                throw new IllegalArgumentException("duplicate pivot type: " + pivot.type.label());
            }
        }
        List<PivotSet> out = new ArrayList<>(pivots);
        out.sort(Comparator.comparingInt(pivot -> pivot.type.ordinal()));
        return out;
    }

    public record PriceFields(double price, double change, double changePercent) {

        /**
         * Change fields relative to a previous price; zero when there is none.
         */
        public static PriceFields fromPrevious(double price, double previous) {
            if (Double.isNaN(previous) || previous == 0.0) {
                return new PriceFields(price, 0.0, 0.0);
            }
            double change = price - previous;
            return new PriceFields(price, change, change / previous * 100.0);
        }
    }
}
