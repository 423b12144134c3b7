package com.cryptobot.ta.runner;

import com.cryptobot.ta.data.OhlcSource;
import com.cryptobot.ta.data.PriceSource;
import com.cryptobot.ta.db.TechnicalAnalysisStore;
import com.cryptobot.ta.error.PersistException;
import com.cryptobot.ta.error.TechnicalAnalysisException;
import com.cryptobot.ta.model.Candle;
import com.cryptobot.ta.model.PriceQuote;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;
import com.cryptobot.ta.remote.MonotonicClock;
import com.cryptobot.utils.StepTimer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runs symbols one after another with a fixed cooldown between them. Storage is
 * best-effort: a failed write is logged and the batch moves on.
 */
public final class BatchRunner {
    private static final Logger log = LogManager.getLogger(BatchRunner.class);

    private final TechnicalAnalysisService service;
    private final OhlcSource ohlcSource;
    private final PriceSource priceSource;
    private final TechnicalAnalysisStore store;
    private final MonotonicClock clock;

    public BatchRunner(
            TechnicalAnalysisService service,
            OhlcSource ohlcSource,
            PriceSource priceSource,
            TechnicalAnalysisStore store,
            MonotonicClock clock
    ) {
        this.service = Objects.requireNonNull(service, "service");
        this.ohlcSource = ohlcSource;
        this.priceSource = priceSource;
        this.store = store;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BatchResult run(List<String> symbols, BatchSettings settings) {
        List<TechnicalAnalysisRecord> records = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        int persisted = 0;
        int persistFailures = 0;
        StepTimer timer = new StepTimer();
        timer.start("TOTAL");

        log.info("Batch start: symbols={} mode={} dry_run={}",
                symbols, settings.mode().name().toLowerCase(Locale.ROOT), settings.dryRun());
        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            log.info("[{}/{}] {}", i + 1, symbols.size(), symbol);
            try {
                timer.start("ANALYZE");
                TechnicalAnalysisRecord record = analyze(symbol, settings);
                timer.end("ANALYZE");
                records.add(record);

                if (settings.dryRun() || store == null) {
                    log.info("{}: not persisted ({})", record.symbol, settings.dryRun() ? "dry run" : "no store");
                } else {
                    timer.start("DB_WRITE");
                    if (persist(record)) {
                        persisted++;
                    } else {
                        persistFailures++;
                    }
                    timer.end("DB_WRITE");
                }
            } catch (TechnicalAnalysisException | IllegalArgumentException | IllegalStateException e) {
                timer.end("ANALYZE");
                String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                failures.put(symbol, message);
                log.error("{}: analysis failed: {}", symbol, message);
            }

            if (i < symbols.size() - 1 && !settings.symbolCooldown().isZero()) {
                try {
                    clock.sleep(settings.symbolCooldown());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Batch interrupted after {}", symbol);
                    for (String skipped : symbols.subList(i + 1, symbols.size())) {
                        failures.put(skipped, "interrupted");
                    }
                    break;
                }
            }
        }
        timer.end("TOTAL");
        log.info("Batch done: ok={} failed={} persisted={} persist_failed={}",
                records.size(), failures.size(), persisted, persistFailures);
        log.info(timer.summaryText());
        return new BatchResult(records, failures, persisted, persistFailures);
    }

    TechnicalAnalysisRecord analyze(String symbol, BatchSettings settings) {
        if (settings.mode() == AcquisitionMode.REMOTE) {
            return service.fetchFromRemote(
                    symbol,
                    settings.exchange(),
                    settings.interval(),
                    settings.rateLimitDelay(),
                    settings.maxRetries(),
                    settings.retryDelay()
            );
        }
        if (ohlcSource == null) {
            throw new IllegalStateException("no OHLC source configured");
        }
        List<Candle> candles = ohlcSource.getOhlc(symbol, settings.days());
        PriceQuote quote = null;
        if (priceSource != null) {
            try {
                quote = priceSource.getPrice(symbol);
            } catch (TechnicalAnalysisException e) {
                log.warn("{}: no live quote, using candle prices: {}", symbol, e.getMessage());
            }
        }
        return service.computeFromOhlc(symbol, candles, quote);
    }

    private boolean persist(TechnicalAnalysisRecord record) {
        try {
            boolean written = store.insert(record);
            if (written) {
                log.info("{}: stored", record.symbol);
            } else {
                log.warn("{}: store reported no row written", record.symbol);
            }
            return written;
        } catch (PersistException e) {
            log.error("{}: store failed: {}", record.symbol, e.getMessage());
            return false;
        }
    }
}
