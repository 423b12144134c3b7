package com.cryptobot.ta.freshness;

import com.cryptobot.ta.assemble.SchemaAssembler;
import com.cryptobot.ta.config.Config;
import com.cryptobot.ta.db.TechnicalAnalysisStore;
import com.cryptobot.ta.error.PersistException;
import com.cryptobot.ta.model.IndicatorResult;
import com.cryptobot.ta.model.IndicatorType;
import com.cryptobot.ta.model.ScalarIndicator;
import com.cryptobot.ta.model.Signal;
import com.cryptobot.ta.model.SummaryLabel;
import com.cryptobot.ta.model.SummaryTriplet;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FreshnessCheckerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void check_classifiesAgeAgainstHourThresholds() {
        InMemoryStore store = new InMemoryStore();
        store.put(record("BTC", NOW.minus(Duration.ofMinutes(59))));
        store.put(record("ETH", NOW.minus(Duration.ofMinutes(60))));
        store.put(record("SOL", NOW.minus(Duration.ofMinutes(119))));
        store.put(record("ADA", NOW.minus(Duration.ofMinutes(120))));
        FreshnessChecker checker = checker(store);

        List<SymbolFreshness> results = checker.checkAll(List.of("btc", "ETH", "SOL", "ADA"));

        assertSame(FreshnessStatus.FRESH, results.get(0).status());
        assertSame(FreshnessStatus.ACCEPTABLE, results.get(1).status());
        assertSame(FreshnessStatus.ACCEPTABLE, results.get(2).status());
        assertSame(FreshnessStatus.STALE, results.get(3).status());
        assertEquals("BTC", results.get(0).symbol());
        assertEquals(59.0, results.get(0).ageMinutes(), 1e-9);
        assertEquals("59.0 minutes", results.get(0).describeAge());
        assertEquals("2.0 hours", results.get(3).describeAge());
    }

    @Test
    void check_missingSymbolIsNoData() {
        SymbolFreshness result = checker(new InMemoryStore()).check("XRP");

        assertSame(FreshnessStatus.NO_DATA, result.status());
        assertNull(result.age());
        assertFalse(result.status().isUsable());
        assertEquals("no_data", result.toJson().getString("status"));
    }

    @Test
    void check_storeFailureIsReportedAsError() {
        InMemoryStore store = new InMemoryStore();
        store.failure = new PersistException("reading latest records failed", new SQLException("connection refused"));

        SymbolFreshness result = checker(store).check("BTC");

        assertSame(FreshnessStatus.ERROR, result.status());
        JSONObject json = result.toJson();
        assertEquals("error", json.getString("status"));
        assertEquals("reading latest records failed", json.getString("error"));
    }

    @Test
    void check_futureTimestampCountsAsFresh() {
        InMemoryStore store = new InMemoryStore();
        store.put(record("BTC", NOW.plus(Duration.ofMinutes(5))));

        SymbolFreshness result = checker(store).check("BTC");

        assertSame(FreshnessStatus.FRESH, result.status());
        assertEquals(Duration.ZERO, result.age());
    }

    @Test
    void toJson_carriesRecordDetails() {
        InMemoryStore store = new InMemoryStore();
        store.put(record("ETH", NOW.minus(Duration.ofMinutes(90))));

        JSONObject json = checker(store).check("ETH").toJson();

        assertEquals("ETH", json.getString("symbol"));
        assertEquals("acceptable", json.getString("status"));
        assertEquals(90.0, json.getDouble("age_minutes"), 1e-9);
        assertEquals(1.5, json.getDouble("age_hours"), 1e-9);
        assertEquals("2024-05-01T10:30:00Z", json.getString("scraped_at"));
        assertEquals(3100.0, json.getDouble("price"), 1e-9);
        assertEquals(1, json.getInt("indicator_count"));
        assertEquals("Buy", json.getString("overall_summary"));
    }

    @Test
    void fromConfig_readsThresholdsAndRejectsInvertedOnes() {
        InMemoryStore store = new InMemoryStore();
        store.put(record("BTC", NOW.minus(Duration.ofMinutes(20))));
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        Config tight = Config.of(Map.of("freshness.fresh_minutes", "15", "freshness.acceptable_minutes", "30"));
        Config inverted = Config.of(Map.of("freshness.fresh_minutes", "90", "freshness.acceptable_minutes", "30"));

        assertSame(FreshnessStatus.ACCEPTABLE, FreshnessChecker.fromConfig(tight, store, clock).check("BTC").status());
        assertThrows(IllegalArgumentException.class, () -> FreshnessChecker.fromConfig(inverted, store, clock));
        assertTrue(FreshnessStatus.FRESH.isUsable());
    }

    private static FreshnessChecker checker(TechnicalAnalysisStore store) {
        return new FreshnessChecker(store, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofHours(1), Duration.ofHours(2));
    }

    private static TechnicalAnalysisRecord record(String symbol, Instant scrapedAt) {
        List<IndicatorResult> indicators = List.of(new ScalarIndicator(IndicatorType.RSI, 25.0, Signal.BUY));
        return new SchemaAssembler(Clock.fixed(scrapedAt, ZoneOffset.UTC)).assemble(
                symbol,
                new SchemaAssembler.PriceFields(3100.0, 0.0, 0.0),
                indicators,
                List.of(),
                List.of(),
                new SummaryTriplet(SummaryLabel.BUY, SummaryLabel.BUY, SummaryLabel.NEUTRAL),
                "https://taapi.io",
                Map.of("provider", "taapi.io"));
    }

    private static final class InMemoryStore implements TechnicalAnalysisStore {
        private final Map<String, TechnicalAnalysisRecord> latestBySymbol = new HashMap<>();
        PersistException failure;

        void put(TechnicalAnalysisRecord record) {
            latestBySymbol.put(record.symbol, record);
        }

        @Override
        public boolean insert(TechnicalAnalysisRecord record) {
            put(record);
            return true;
        }

        @Override
        public List<TechnicalAnalysisRecord> latest(String symbol, int limit) {
            if (failure != null) {
                throw failure;
            }
            List<TechnicalAnalysisRecord> out = new ArrayList<>();
            TechnicalAnalysisRecord record = latestBySymbol.get(symbol);
            if (record != null && limit > 0) {
                out.add(record);
            }
            return out;
        }
    }
}
