package com.cryptobot.ta.runner;

import com.cryptobot.ta.assemble.SchemaAssembler;
import com.cryptobot.ta.config.CryptoRegistry;
import com.cryptobot.ta.data.PriceSource;
import com.cryptobot.ta.error.IndicatorFetchException;
import com.cryptobot.ta.error.InsufficientDataException;
import com.cryptobot.ta.error.TechnicalAnalysisException;
import com.cryptobot.ta.error.UnsupportedSymbolException;
import com.cryptobot.ta.indicator.IndicatorComputer;
import com.cryptobot.ta.indicator.TestCandles;
import com.cryptobot.ta.indicator.VolumeProxy;
import com.cryptobot.ta.model.IndicatorType;
import com.cryptobot.ta.model.PriceQuote;
import com.cryptobot.ta.model.Signal;
import com.cryptobot.ta.model.SummaryLabel;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;
import com.cryptobot.ta.remote.FakeMonotonicClock;
import com.cryptobot.ta.remote.FetchTarget;
import com.cryptobot.ta.remote.IndicatorSpec;
import com.cryptobot.ta.remote.RemoteIndicatorSource;
import com.cryptobot.ta.signal.SignalClassifier;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TechnicalAnalysisServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void computeFromOhlc_flatSeriesIsNeutralWithLocalMetadata() {
        TechnicalAnalysisService service = service(null, null, new FakeMonotonicClock());

        TechnicalAnalysisRecord record = service.computeFromOhlc("btc", TestCandles.flat(60, 100.0));

        assertEquals("BTC", record.symbol);
        assertEquals(100.0, record.price, 1e-9);
        assertEquals(0.0, record.priceChange, 1e-9);
        assertSame(SummaryLabel.NEUTRAL, record.summary.overall());
        assertSame(SummaryLabel.NEUTRAL, record.summary.technicalIndicators());
        assertSame(SummaryLabel.NEUTRAL, record.summary.movingAverages());
        assertEquals("coingecko", record.metadata.get("provider"));
        assertEquals(60, record.metadata.get("dataPoints"));
        assertEquals(VolumeProxy.SOURCE_LABEL, record.metadata.get("volumeSource"));
        assertEquals("agreement", record.metadata.get("summaryPolicy"));
        assertEquals("direction", record.metadata.get("voteCounting"));
        assertEquals(List.of("Classic"), record.metadata.get("pivotTypes"));
        assertTrue(record.errors().isEmpty());
        assertEquals(NOW, record.scrapedAt);
        assertEquals(1, record.pivotPoints.size());
    }

    @Test
    void computeFromOhlc_quoteOverridesCandlePrice() {
        TechnicalAnalysisService service = service(null, null, new FakeMonotonicClock());
        PriceQuote quote = new PriceQuote(101.5, 1.5, 1.5, 2_000_000.0, 50_000.0, NOW);

        TechnicalAnalysisRecord record = service.computeFromOhlc("ETH", TestCandles.flat(60, 100.0), quote);

        assertEquals(101.5, record.price, 1e-9);
        assertEquals(1.5, record.priceChangePercent, 1e-9);
        @SuppressWarnings("unchecked")
        Map<String, Object> marketData = (Map<String, Object>) record.metadata.get("marketData");
        assertEquals(2_000_000.0, marketData.get("marketCap"));
        assertEquals("2024-05-01T12:00:00Z", marketData.get("asOf"));
    }

    @Test
    void computeFromOhlc_shortSeriesFails() {
        TechnicalAnalysisService service = service(null, null, new FakeMonotonicClock());

        assertThrows(InsufficientDataException.class,
                () -> service.computeFromOhlc("BTC", TestCandles.flat(10, 100.0)));
    }

    @Test
    void fetchFromRemote_completeFetchUsesUnionVote() {
        FakeMonotonicClock clock = new FakeMonotonicClock();
        FakeRemoteSource source = new FakeRemoteSource(Set.of());
        TechnicalAnalysisService service = service(source, new FixedPriceSource(100.0), clock);

        TechnicalAnalysisRecord record = service.fetchFromRemote(
                "btc", "binance", "1h", Duration.ofSeconds(18), 5, Duration.ofSeconds(30));

        assertEquals("BTC", record.symbol);
        assertEquals(List.of("BTC/USDT"), source.symbolPairs);
        assertEquals(9, record.technicalIndicators.size());
        assertEquals(3, record.movingAverages.size());
        assertTrue(record.pivotPoints.isEmpty());
        assertEquals("taapi.io", record.metadata.get("provider"));
        assertEquals("complete", record.metadata.get("status"));
        assertEquals("union-vote", record.metadata.get("summaryPolicy"));
        assertEquals("literal", record.metadata.get("voteCounting"));
        assertEquals(1.0, record.metadata.get("successRatio"));
        assertEquals(12, record.metadata.get("attempts"));
        assertTrue(record.errors().isEmpty());
        assertSame(SummaryLabel.NEUTRAL, record.summary.technicalIndicators());
        assertSame(SummaryLabel.STRONG_BUY, record.summary.movingAverages());
        assertSame(SummaryLabel.BUY, record.summary.overall());
        assertEquals(Duration.ofSeconds(18 * 11), clock.totalSlept());
    }

    @Test
    void fetchFromRemote_onlyLiteralBuyAndSellLabelsVote() {
        Map<String, JSONObject> payloads = new HashMap<>();
        payloads.put("rsi", new JSONObject().put("value", 50.0));
        payloads.put("bbands", new JSONObject().put("valueUpperBand", 115.0).put("valueMiddleBand", 110.0)
                .put("valueLowerBand", 105.0));
        payloads.put("obv", new JSONObject().put("value", 1000.0));
        payloads.put("stochrsi", new JSONObject().put("valueFastK", 50.0).put("valueFastD", 50.0));
        payloads.put("vwap", new JSONObject().put("value", 90.0));
        payloads.put("cmf", new JSONObject().put("value", 0.1));
        payloads.put("ema20", new JSONObject().put("value", 110.0));
        payloads.put("ema50", new JSONObject().put("value", 110.0));
        payloads.put("ema200", new JSONObject().put("value", 110.0));
        FakeRemoteSource source = new FakeRemoteSource(Set.of(), payloads);
        TechnicalAnalysisService service = service(source, new FixedPriceSource(100.0), new FakeMonotonicClock());

        TechnicalAnalysisRecord record = service.fetchFromRemote(
                "BTC", "binance", "1h", Duration.ZERO, 0, Duration.ZERO);

        assertSame(Signal.OVERSOLD, record.indicator(IndicatorType.BOLLINGER_BANDS).signal());
        assertSame(Signal.ACCUMULATION, record.indicator(IndicatorType.OBV).signal());
        assertSame(Signal.BULLISH, record.indicator(IndicatorType.VWAP).signal());
        assertSame(Signal.BUYING_PRESSURE, record.indicator(IndicatorType.CMF).signal());
        assertSame(SummaryLabel.NEUTRAL, record.summary.technicalIndicators());
        assertSame(SummaryLabel.STRONG_SELL, record.summary.movingAverages());
        assertSame(SummaryLabel.NEUTRAL, record.summary.overall());
    }

    @Test
    void fetchFromRemote_unexpectedPriceSourceFailureIsRecorded() {
        FakeRemoteSource source = new FakeRemoteSource(Set.of());
        PriceSource broken = symbol -> {
            throw new IllegalStateException("price cache closed");
        };
        TechnicalAnalysisService service = service(source, broken, new FakeMonotonicClock());

        TechnicalAnalysisRecord record = service.fetchFromRemote(
                "BTC", "binance", "1h", Duration.ZERO, 0, Duration.ZERO);

        assertTrue(Double.isNaN(record.price));
        assertEquals("price: price cache closed", record.errors().get(0));
        assertTrue(record.errors().get(1).startsWith("price unavailable"));
        assertEquals(12, source.calls);
        assertEquals("complete", record.metadata.get("status"));
    }

    @Test
    void fetchFromRemote_partialFetchStillProducesRecord() {
        FakeMonotonicClock clock = new FakeMonotonicClock();
        FakeRemoteSource source = new FakeRemoteSource(Set.of("obv", "vwap", "ema200"));
        TechnicalAnalysisService service = service(source, new FixedPriceSource(100.0), clock);

        TechnicalAnalysisRecord record = service.fetchFromRemote(
                "ETH", "binance", "4h", Duration.ZERO, 5, Duration.ofSeconds(30));

        assertEquals(7, record.technicalIndicators.size());
        assertEquals(2, record.movingAverages.size());
        assertNull(record.indicator(IndicatorType.OBV));
        assertNull(record.movingAverage(200));
        assertEquals("partial", record.metadata.get("status"));
        assertEquals(0.75, record.metadata.get("successRatio"));
        assertEquals(9, record.metadata.get("indicatorsFetched"));
        assertEquals(24, record.metadata.get("attempts"));
        assertEquals(4, record.metadata.get("retryRounds"));
        assertEquals("4h", record.metadata.get("interval"));
        assertEquals(3, record.errors().size());
        assertTrue(record.errors().get(0).startsWith("obv: "));
        assertEquals(24, source.calls);
    }

    @Test
    void fetchFromRemote_withoutPriceSourceUsesRemotePrice() {
        FakeMonotonicClock clock = new FakeMonotonicClock();
        FakeRemoteSource source = new FakeRemoteSource(Set.of());
        TechnicalAnalysisService service = service(source, null, clock);

        TechnicalAnalysisRecord record = service.fetchFromRemote(
                "SOL", "binance", "1h", Duration.ZERO, 0, Duration.ZERO);

        assertEquals(100.0, record.price, 1e-9);
        assertEquals(13, source.calls);
        assertEquals("price", source.keys.get(0));
    }

    @Test
    void fetchFromRemote_unknownPriceLeavesPriceSignalsNeutral() {
        FakeMonotonicClock clock = new FakeMonotonicClock();
        FakeRemoteSource source = new FakeRemoteSource(Set.of("price"));
        TechnicalAnalysisService service = service(source, null, clock);

        TechnicalAnalysisRecord record = service.fetchFromRemote(
                "SOL", "binance", "1h", Duration.ZERO, 0, Duration.ZERO);

        assertTrue(Double.isNaN(record.price));
        assertSame(Signal.NEUTRAL, record.indicator(IndicatorType.VWAP).signal());
        assertSame(Signal.NEUTRAL, record.movingAverage(20).signal);
        assertTrue(record.errors().stream().anyMatch(e -> e.startsWith("price: ")));
        assertEquals("complete", record.metadata.get("status"));
    }

    @Test
    void fetchFromRemote_unsupportedSymbolFailsBeforeAnyCall() {
        FakeRemoteSource source = new FakeRemoteSource(Set.of());
        TechnicalAnalysisService service = service(source, new FixedPriceSource(1.0), new FakeMonotonicClock());

        assertThrows(UnsupportedSymbolException.class, () -> service.fetchFromRemote(
                "SHIB", "binance", "1h", Duration.ZERO, 5, Duration.ZERO));
        assertEquals(0, source.calls);
    }

    @Test
    void fetchFromRemote_allFailedIsReportedNotThrown() {
        Set<String> all = new HashSet<>();
        for (IndicatorSpec spec : IndicatorSpec.defaults()) {
            all.add(spec.key());
        }
        TechnicalAnalysisService service = service(new FakeRemoteSource(all), new FailingPriceSource(),
                new FakeMonotonicClock());

        TechnicalAnalysisRecord record = service.fetchFromRemote(
                "BTC", "binance", "1h", Duration.ZERO, 1, Duration.ZERO);

        assertEquals("failed", record.metadata.get("status"));
        assertTrue(record.technicalIndicators.isEmpty());
        assertSame(SummaryLabel.NEUTRAL, record.summary.overall());
        assertFalse(record.errors().isEmpty());
    }

    static TechnicalAnalysisService service(RemoteIndicatorSource remote, PriceSource prices, FakeMonotonicClock clock) {
        return new TechnicalAnalysisService(
                CryptoRegistry.defaults(),
                new IndicatorComputer(),
                new SignalClassifier(),
                new SchemaAssembler(Clock.fixed(NOW, ZoneOffset.UTC)),
                remote,
                prices,
                clock,
                "https://taapi.io",
                "https://www.coingecko.com"
        );
    }

    static final class FakeRemoteSource implements RemoteIndicatorSource {
        private final Set<String> failing;
        private final Map<String, JSONObject> overrides;
        final List<String> keys = new ArrayList<>();
        final List<String> symbolPairs = new ArrayList<>();
        int calls;

        FakeRemoteSource(Set<String> failing) {
            this(failing, Map.of());
        }

        FakeRemoteSource(Set<String> failing, Map<String, JSONObject> overrides) {
            this.failing = failing;
            this.overrides = overrides;
        }

        @Override
        public JSONObject fetch(IndicatorSpec spec, FetchTarget target) {
            calls++;
            keys.add(spec.key());
            if (!symbolPairs.contains(target.symbolPair())) {
                symbolPairs.add(target.symbolPair());
            }
            if (failing.contains(spec.key())) {
                throw new IndicatorFetchException(spec.key(), IndicatorFetchException.RATE_LIMIT, "HTTP 429 Too Many Requests");
            }
            if (overrides.containsKey(spec.key())) {
                return overrides.get(spec.key());
            }
            switch (spec.key()) {
                case "macd":
                    return new JSONObject().put("valueMACD", 2.0).put("valueMACDSignal", 1.0).put("valueMACDHist", 1.0);
                case "bbands":
                    return new JSONObject().put("valueUpperBand", 110.0).put("valueMiddleBand", 100.0)
                            .put("valueLowerBand", 90.0);
                case "stochrsi":
                    return new JSONObject().put("valueFastK", 10.0).put("valueFastD", 15.0);
                case "supertrend":
                    return new JSONObject().put("value", 90.0).put("valueAdvice", "long");
                case "rsi":
                    return new JSONObject().put("value", 25.0);
                case "obv":
                    return new JSONObject().put("value", 5000.0);
                case "atr":
                    return new JSONObject().put("value", 1.0);
                case "vwap":
                    return new JSONObject().put("value", 95.0);
                case "cmf":
                    return new JSONObject().put("value", 0.2);
                default:
                    return new JSONObject().put("value", "price".equals(spec.key()) ? 100.0 : 80.0);
            }
        }
    }

    static final class FixedPriceSource implements PriceSource {
        private final double price;

        FixedPriceSource(double price) {
            this.price = price;
        }

        @Override
        public PriceQuote getPrice(String symbol) {
            return new PriceQuote(price, 0.0, 0.0, 0.0, 0.0, NOW);
        }
    }

    static final class FailingPriceSource implements PriceSource {
        @Override
        public PriceQuote getPrice(String symbol) {
            throw new TechnicalAnalysisException("price lookup failed for " + symbol);
        }
    }
}
