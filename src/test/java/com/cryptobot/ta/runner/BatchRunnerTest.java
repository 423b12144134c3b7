package com.cryptobot.ta.runner;

import com.cryptobot.ta.config.Config;
import com.cryptobot.ta.data.OhlcSource;
import com.cryptobot.ta.db.TechnicalAnalysisStore;
import com.cryptobot.ta.error.PersistException;
import com.cryptobot.ta.indicator.TestCandles;
import com.cryptobot.ta.model.Candle;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;
import com.cryptobot.ta.remote.FakeMonotonicClock;
import com.cryptobot.ta.remote.MonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchRunnerTest {

    private static final BatchSettings LOCAL = new BatchSettings(
            AcquisitionMode.LOCAL, "binance", "1h", 30,
            Duration.ZERO, 0, Duration.ZERO, Duration.ofSeconds(5), false);

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void run_sleepsCooldownBetweenSymbolsOnly() {
        FakeMonotonicClock clock = new FakeMonotonicClock();
        RecordingStore store = new RecordingStore(Set.of());
        BatchRunner runner = runner(new FakeOhlcSource(Set.of()), store, clock);

        BatchResult result = runner.run(List.of("BTC", "ETH", "SOL"), LOCAL);

        assertTrue(result.allSucceeded());
        assertEquals(3, result.records.size());
        assertEquals(3, result.persisted);
        assertEquals(2, clock.sleeps.size());
        assertEquals(Duration.ofSeconds(10), clock.totalSlept());
        assertEquals(List.of("BTC", "ETH", "SOL"), store.symbols);
    }

    @Test
    void run_persistFailureDoesNotFailTheBatch() {
        RecordingStore store = new RecordingStore(Set.of("ETH"));
        BatchRunner runner = runner(new FakeOhlcSource(Set.of()), store, new FakeMonotonicClock());

        BatchResult result = runner.run(List.of("BTC", "ETH", "SOL"), LOCAL);

        assertTrue(result.allSucceeded());
        assertEquals(3, result.records.size());
        assertEquals(2, result.persisted);
        assertEquals(1, result.persistFailures);
    }

    @Test
    void run_dryRunSkipsStorage() {
        RecordingStore store = new RecordingStore(Set.of());
        BatchRunner runner = runner(new FakeOhlcSource(Set.of()), store, new FakeMonotonicClock());

        BatchResult result = runner.run(List.of("BTC", "ETH"), LOCAL.withDryRun(true));

        assertEquals(2, result.records.size());
        assertEquals(0, result.persisted);
        assertTrue(store.symbols.isEmpty());
    }

    @Test
    void run_failedSymbolIsRecordedAndBatchContinues() {
        BatchRunner runner = runner(new FakeOhlcSource(Set.of("ETH")), null, new FakeMonotonicClock());

        BatchResult result = runner.run(List.of("BTC", "ETH", "SOL"), LOCAL);

        assertFalse(result.allSucceeded());
        assertEquals(2, result.records.size());
        assertEquals(Set.of("ETH"), result.failures.keySet());
        assertTrue(result.failures.get("ETH").contains("Insufficient data"));
    }

    @Test
    void run_interruptMarksRemainingSymbols() {
        InterruptingClock interrupting = new InterruptingClock();
        BatchRunner runner = runner(new FakeOhlcSource(Set.of()), null, interrupting);

        BatchResult result = runner.run(List.of("BTC", "ETH", "SOL"), LOCAL);

        assertEquals(1, result.records.size());
        assertEquals("interrupted", result.failures.get("ETH"));
        assertEquals("interrupted", result.failures.get("SOL"));
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void settings_fromConfigDefaults() {
        BatchSettings settings = BatchSettings.fromConfig(Config.of(Map.of()));

        assertEquals(AcquisitionMode.REMOTE, settings.mode());
        assertEquals(Duration.ofSeconds(18), settings.rateLimitDelay());
        assertEquals(5, settings.maxRetries());
        assertEquals(Duration.ofSeconds(30), settings.retryDelay());
        assertEquals(30, settings.days());
    }

    private static BatchRunner runner(OhlcSource ohlc, TechnicalAnalysisStore store,
                                      MonotonicClock clock) {
        FakeMonotonicClock serviceClock = new FakeMonotonicClock();
        return new BatchRunner(TechnicalAnalysisServiceTest.service(null, null, serviceClock), ohlc, null, store, clock);
    }

    private static final class FakeOhlcSource implements OhlcSource {
        private final Set<String> shortSymbols;

        private FakeOhlcSource(Set<String> shortSymbols) {
            this.shortSymbols = shortSymbols;
        }

        @Override
        public List<Candle> getOhlc(String symbol, int days) {
            return shortSymbols.contains(symbol) ? TestCandles.flat(20, 50.0) : TestCandles.wave(90);
        }
    }

    private static final class RecordingStore implements TechnicalAnalysisStore {
        private final Set<String> failing;
        final List<String> symbols = new ArrayList<>();

        private RecordingStore(Set<String> failing) {
            this.failing = failing;
        }

        @Override
        public boolean insert(TechnicalAnalysisRecord record) {
            if (failing.contains(record.symbol)) {
                throw new PersistException("insert failed for " + record.symbol, new SQLException("connection reset"));
            }
            symbols.add(record.symbol);
            return true;
        }

        @Override
        public List<TechnicalAnalysisRecord> latest(String symbol, int limit) {
            return List.of();
        }
    }

    private static final class InterruptingClock implements MonotonicClock {
        @Override
        public long nanoTime() {
            return 0L;
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            throw new InterruptedException("stop");
        }
    }
}
