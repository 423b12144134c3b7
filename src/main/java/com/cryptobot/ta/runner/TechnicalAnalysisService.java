package com.cryptobot.ta.runner;

import com.cryptobot.ta.assemble.SchemaAssembler;
import com.cryptobot.ta.assemble.SchemaAssembler.PriceFields;
import com.cryptobot.ta.config.CryptoRegistry;
import com.cryptobot.ta.data.PriceSource;
import com.cryptobot.ta.error.IndicatorFetchException;
import com.cryptobot.ta.indicator.IndicatorComputer;
import com.cryptobot.ta.indicator.IndicatorSet;
import com.cryptobot.ta.indicator.VolumeProxy;
import com.cryptobot.ta.model.Candle;
import com.cryptobot.ta.model.CryptoAsset;
import com.cryptobot.ta.model.PivotSet;
import com.cryptobot.ta.model.PriceQuote;
import com.cryptobot.ta.model.SummaryTriplet;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;
import com.cryptobot.ta.remote.FetchReport;
import com.cryptobot.ta.remote.FetchTarget;
import com.cryptobot.ta.remote.IndicatorFetchOrchestrator;
import com.cryptobot.ta.remote.IndicatorSpec;
import com.cryptobot.ta.remote.MonotonicClock;
import com.cryptobot.ta.remote.RateLimiter;
import com.cryptobot.ta.remote.RemoteIndicatorSource;
import com.cryptobot.ta.signal.SignalClassifier;
import com.cryptobot.ta.summary.AgreementPolicy;
import com.cryptobot.ta.summary.SummaryAggregator;
import com.cryptobot.ta.summary.UnionVotePolicy;
import com.cryptobot.ta.summary.VoteCounting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Entry points of both acquisition paths. Each returns a canonical record.
 */
public final class TechnicalAnalysisService {
    private static final Logger log = LogManager.getLogger(TechnicalAnalysisService.class);

    public static final String REMOTE_PROVIDER = "taapi.io";
    public static final String LOCAL_PROVIDER = "coingecko";

    private final CryptoRegistry registry;
    private final IndicatorComputer computer;
    private final SignalClassifier classifier;
    private final SchemaAssembler assembler;
    private final RemoteIndicatorSource remoteSource;
    private final PriceSource priceSource;
    private final MonotonicClock clock;
    private final String remoteSourceUrl;
    private final String localSourceUrl;

    private final SummaryAggregator localAggregator =
            new SummaryAggregator(new AgreementPolicy(), VoteCounting.DIRECTION);
    private final SummaryAggregator remoteAggregator =
            new SummaryAggregator(new UnionVotePolicy(), VoteCounting.LITERAL);
    private RateLimiter rateLimiter;

    public TechnicalAnalysisService(
            CryptoRegistry registry,
            IndicatorComputer computer,
            SignalClassifier classifier,
            SchemaAssembler assembler,
            RemoteIndicatorSource remoteSource,
            PriceSource priceSource,
            MonotonicClock clock,
            String remoteSourceUrl,
            String localSourceUrl
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.computer = Objects.requireNonNull(computer, "computer");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.remoteSource = remoteSource;
        this.priceSource = priceSource;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.remoteSourceUrl = remoteSourceUrl == null ? "" : remoteSourceUrl;
        this.localSourceUrl = localSourceUrl == null ? "" : localSourceUrl;
    }

    public TechnicalAnalysisRecord computeFromOhlc(String symbol, List<Candle> candles) {
        return computeFromOhlc(symbol, candles, null);
    }

    /**
     * Local path. Fails with InsufficientDataException below the minimum candle count.
     * A supplied quote overrides the candle-derived price fields.
     */
    public TechnicalAnalysisRecord computeFromOhlc(String symbol, List<Candle> candles, PriceQuote quote) {
        IndicatorSet set = computer.compute(candles);
        SummaryTriplet summary = localAggregator.summarize(set.indicators, set.movingAverages);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", LOCAL_PROVIDER);
        metadata.put("dataPoints", set.dataPoints);
        metadata.put("volumeSource", VolumeProxy.SOURCE_LABEL);
        metadata.put("summaryPolicy", localAggregator.policy().name());
        metadata.put("voteCounting", localAggregator.counting().label());
        metadata.put("pivotTypes", pivotLabels(set.pivots));

        PriceFields price;
        if (quote != null) {
            price = new PriceFields(quote.price, quote.change24h, quote.changePercent24h);
            Map<String, Object> marketData = new LinkedHashMap<>();
            marketData.put("marketCap", quote.marketCap);
            marketData.put("volume24h", quote.volume24h);
            marketData.put("asOf", DateTimeFormatter.ISO_INSTANT.format(quote.asOf));
            metadata.put("marketData", marketData);
        } else {
            price = PriceFields.fromPrevious(set.lastClose, set.previousClose);
        }
        metadata.put("errors", List.of());

        TechnicalAnalysisRecord record = assembler.assemble(
                symbol, price, set.indicators, set.movingAverages, set.pivots, summary, localSourceUrl, metadata);
        log.info("{}: local analysis over {} candles, overall={}", record.symbol, set.dataPoints,
                summary.overall().label());
        return record;
    }

    /**
     * Remote path. Never fails because of fetch errors: what could be fetched is classified,
     * the rest is listed in {@code metadata.errors}.
     */
    public TechnicalAnalysisRecord fetchFromRemote(
            String symbol,
            String exchange,
            String interval,
            Duration rateLimitDelay,
            int maxRetries,
            Duration retryDelay
    ) {
        if (remoteSource == null) {
            throw new IllegalStateException("no remote indicator source configured");
        }
        CryptoAsset asset = registry.require(baseSymbol(symbol));
        FetchTarget target = new FetchTarget(asset.usdtPair(), exchange, interval);
        RateLimiter limiter = limiterFor(rateLimitDelay);
        List<String> errors = new ArrayList<>();

        PriceQuote quote = null;
        double price = Double.NaN;
        if (priceSource != null) {
            try {
                quote = priceSource.getPrice(asset.symbol);
                price = quote.price;
            } catch (RuntimeException e) {
                String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                errors.add("price: " + message);
                log.warn("{}: price lookup failed: {}", asset.symbol, message);
            }
        } else {
            price = fetchRemotePrice(limiter, target, errors);
        }

        IndicatorFetchOrchestrator orchestrator =
                new IndicatorFetchOrchestrator(remoteSource, limiter, clock, maxRetries, retryDelay);
        List<IndicatorSpec> specs = IndicatorSpec.defaults();
        FetchReport report = orchestrator.fetchAll(target, specs);

        Map<String, JSONObject> payloads = new LinkedHashMap<>();
        for (IndicatorSpec spec : specs) {
            JSONObject payload = report.payload(spec.key());
            if (payload != null) {
                payloads.put(spec.key(), payload);
            }
        }
        for (Map.Entry<String, String> error : report.errors().entrySet()) {
            errors.add(error.getKey() + ": " + error.getValue());
        }
        SignalClassifier.Classification classified = classifier.classify(payloads, price);
        errors.addAll(classified.issues);
        if (Double.isNaN(price)) {
            errors.add("price unavailable: price-relative signals read Neutral");
        }

        SummaryTriplet summary = remoteAggregator.summarize(classified.indicators, classified.movingAverages);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", REMOTE_PROVIDER);
        metadata.put("exchange", target.exchange());
        metadata.put("interval", target.interval());
        metadata.put("indicatorsRequested", report.requested());
        metadata.put("indicatorsFetched", report.successCount());
        metadata.put("successRatio", Math.round(report.successRatio() * 10000.0) / 10000.0);
        metadata.put("attempts", report.attempts);
        metadata.put("retryRounds", report.roundsExecuted);
        metadata.put("status", status(report));
        metadata.put("summaryPolicy", remoteAggregator.policy().name());
        metadata.put("voteCounting", remoteAggregator.counting().label());
        if (report.interrupted) {
            metadata.put("interrupted", true);
        }
        metadata.put("errors", errors);

        PriceFields priceFields = quote != null
                ? new PriceFields(quote.price, quote.change24h, quote.changePercent24h)
                : new PriceFields(price, 0.0, 0.0);

        TechnicalAnalysisRecord record = assembler.assemble(
                asset.symbol, priceFields, classified.indicators, classified.movingAverages, List.of(),
                summary, remoteSourceUrl, metadata);
        log.info("{}: remote analysis {}/{} indicators, overall={}", record.symbol,
                report.successCount(), report.requested(), summary.overall().label());
        return record;
    }

    private double fetchRemotePrice(RateLimiter limiter, FetchTarget target, List<String> errors) {
        try {
            limiter.waitForSlot();
            JSONObject payload = remoteSource.fetch(IndicatorSpec.price(), target);
            double value = payload == null ? Double.NaN : payload.optDouble("value", Double.NaN);
            if (Double.isNaN(value)) {
                errors.add("price: missing field value");
            }
            return value;
        } catch (IndicatorFetchException e) {
            errors.add("price: " + e.getMessage());
            log.warn("{}: price fetch failed: {}", target.symbolPair(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("price: interrupted");
        }
        return Double.NaN;
    }

    private RateLimiter limiterFor(Duration delay) {
        Duration normalized = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        if (rateLimiter == null || !rateLimiter.delay().equals(normalized)) {
            rateLimiter = new RateLimiter(normalized, clock);
        }
        return rateLimiter;
    }

    private static String status(FetchReport report) {
        int fetched = report.successCount();
        if (fetched == report.requested()) {
            return "complete";
        }
        return fetched == 0 ? "failed" : "partial";
    }

    private static String baseSymbol(String symbol) {
        String value = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        int slash = value.indexOf('/');
        return slash > 0 ? value.substring(0, slash) : value;
    }

    private static List<String> pivotLabels(List<PivotSet> pivots) {
        List<String> out = new ArrayList<>(pivots.size());
        for (PivotSet pivot : pivots) {
            out.add(pivot.type.label());
        }
        return out;
    }
}
