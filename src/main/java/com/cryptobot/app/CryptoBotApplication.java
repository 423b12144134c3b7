package com.cryptobot.app;

import com.cryptobot.data.http.HttpClientEx;
import com.cryptobot.ta.assemble.RecordJson;
import com.cryptobot.ta.assemble.SchemaAssembler;
import com.cryptobot.ta.config.Config;
import com.cryptobot.ta.config.CryptoRegistry;
import com.cryptobot.ta.data.CoinGeckoClient;
import com.cryptobot.ta.data.PriceSource;
import com.cryptobot.ta.db.Database;
import com.cryptobot.ta.db.MigrationRunner;
import com.cryptobot.ta.db.TechnicalAnalysisDao;
import com.cryptobot.ta.db.TechnicalAnalysisStore;
import com.cryptobot.ta.error.PersistException;
import com.cryptobot.ta.error.TechnicalAnalysisException;
import com.cryptobot.ta.freshness.FreshnessChecker;
import com.cryptobot.ta.freshness.SymbolFreshness;
import com.cryptobot.ta.indicator.IndicatorComputer;
import com.cryptobot.ta.model.CryptoAsset;
import com.cryptobot.ta.model.PivotType;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;
import com.cryptobot.ta.remote.MonotonicClock;
import com.cryptobot.ta.remote.RemoteIndicatorSource;
import com.cryptobot.ta.remote.TaapiClient;
import com.cryptobot.ta.runner.AcquisitionMode;
import com.cryptobot.ta.runner.BatchResult;
import com.cryptobot.ta.runner.BatchRunner;
import com.cryptobot.ta.runner.BatchSettings;
import com.cryptobot.ta.runner.TechnicalAnalysisService;
import com.cryptobot.ta.signal.SignalClassifier;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public final class CryptoBotApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new CryptoBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("cryptobot", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("cryptobot", options);
            return 0;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        installLogRoutingIfNeeded(config);
        Logger log = LogManager.getLogger(CryptoBotApplication.class);

        BatchSettings settings;
        List<CryptoAsset> assets;
        CryptoRegistry registry = CryptoRegistry.defaults();
        try {
            settings = resolveSettings(cmd, config);
            assets = registry.resolve(resolveSymbols(cmd, config));
        } catch (IllegalArgumentException | TechnicalAnalysisException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        try {
            if (cmd.hasOption("freshness")) {
                return checkFreshness(cmd, config, resolveFreshnessSymbols(cmd, assets, registry), log);
            }
            if (cmd.hasOption("latest")) {
                return printLatest(cmd, config, assets, log);
            }

            HttpClientEx http = new HttpClientEx();
            CoinGeckoClient coinGecko = new CoinGeckoClient(config, http, registry);
            RemoteIndicatorSource remote = null;
            PriceSource remotePriceSource = coinGecko;
            if (settings.mode() == AcquisitionMode.REMOTE) {
                remote = new TaapiClient(config, http);
                if ("taapi".equalsIgnoreCase(config.getString("taapi.price_source", "coingecko"))) {
                    remotePriceSource = null;
                }
            }

            MonotonicClock clock = MonotonicClock.system();
            TechnicalAnalysisService service = new TechnicalAnalysisService(
                    registry,
                    new IndicatorComputer(resolvePivotTypes(config), config.getInt("indicators.min_candles", 50)),
                    new SignalClassifier(),
                    new SchemaAssembler(),
                    remote,
                    remotePriceSource,
                    clock,
                    config.getString("taapi.source_url", "https://taapi.io"),
                    config.getString("coingecko.source_url", "https://www.coingecko.com")
            );
            TechnicalAnalysisStore store = settings.dryRun() ? null : openStore(config, log);
            BatchRunner runner = new BatchRunner(service, coinGecko, coinGecko, store, clock);

            List<String> symbols = new ArrayList<>();
            for (CryptoAsset asset : assets) {
                symbols.add(asset.symbol);
            }
            BatchResult result = runner.run(symbols, settings);
            for (TechnicalAnalysisRecord record : result.records) {
                log.info("{}: price={} overall={} indicators={} ma={}",
                        record.symbol,
                        record.price,
                        record.summary.overall().label(),
                        record.summary.technicalIndicators().label(),
                        record.summary.movingAverages().label());
            }
            if (cmd.hasOption("out")) {
                writeJson(Path.of(cmd.getOptionValue("out")), result.records);
                log.info("Wrote {} records to {}", result.records.size(), cmd.getOptionValue("out"));
            }
            if (!result.allSucceeded()) {
                log.error("Failed symbols: {}", result.failures);
                return 1;
            }
            return 0;
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            log.fatal("FATAL: {}", e.getMessage(), e);
            return 1;
        }
    }

    private int printLatest(CommandLine cmd, Config config, List<CryptoAsset> assets, Logger log)
            throws SQLException, IOException {
        int limit = parsePositive(cmd.getOptionValue("latest"), "latest");
        Database database = Database.fromConfig(config);
        new MigrationRunner().run(database);
        TechnicalAnalysisStore store = new TechnicalAnalysisDao(database);
        List<TechnicalAnalysisRecord> records = new ArrayList<>();
        try {
            if (cmd.hasOption("symbols")) {
                for (CryptoAsset asset : assets) {
                    records.addAll(store.latest(asset.symbol, limit));
                }
            } else {
                records.addAll(store.latest(null, limit));
            }
        } catch (PersistException e) {
            log.error("Reading stored records failed: {}", e.getMessage());
            return 1;
        }
        for (TechnicalAnalysisRecord record : records) {
            log.info("{} {} price={} overall={}", record.scrapedAt, record.symbol, record.price,
                    record.summary.overall().label());
        }
        if (cmd.hasOption("out")) {
            writeJson(Path.of(cmd.getOptionValue("out")), records);
        }
        return 0;
    }

    private int checkFreshness(CommandLine cmd, Config config, List<String> symbols, Logger log) throws SQLException {
        Database database = Database.fromConfig(config);
        new MigrationRunner().run(database);
        FreshnessChecker checker = FreshnessChecker.fromConfig(config, new TechnicalAnalysisDao(database), Clock.systemUTC());
        List<SymbolFreshness> results = checker.checkAll(symbols);
        if (cmd.hasOption("json")) {
            JSONObject json = new JSONObject();
            for (SymbolFreshness result : results) {
                json.put(result.symbol(), result.toJson());
            }
            System.out.println(json.toString(2));
        } else {
            for (SymbolFreshness result : results) {
                if (result.age() == null) {
                    log.info("{}: {} ({})", result.symbol(), result.status().label(), result.message());
                } else {
                    log.info("{}: {} age={} scraped={} price={} indicators={} overall={}",
                            result.symbol(),
                            result.status().label(),
                            result.describeAge(),
                            result.scrapedAt(),
                            result.price(),
                            result.indicatorCount(),
                            result.overallSummary());
                }
            }
        }
        for (SymbolFreshness result : results) {
            if (!result.status().isUsable()) {
                return 1;
            }
        }
        return 0;
    }

    private TechnicalAnalysisStore openStore(Config config, Logger log) {
        if (!config.getBoolean("db.enabled", true)) {
            log.info("Storage disabled (db.enabled=false)");
            return null;
        }
        try {
            Database database = Database.fromConfig(config);
            new MigrationRunner().run(database);
            log.info("Storage ready: {}", database.maskedJdbcUrl());
            return new TechnicalAnalysisDao(database);
        } catch (SQLException | IllegalArgumentException e) {
            log.warn("Storage unavailable, records will not be persisted: {}", e.getMessage());
            return null;
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (CryptoBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("cryptobot.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must be initialized before the swap so the console appender keeps the real streams.
                LogManager.getLogger(CryptoBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static BatchSettings resolveSettings(CommandLine cmd, Config config) {
        BatchSettings settings = BatchSettings.fromConfig(config);
        if (cmd.hasOption("mode")) {
            settings = settings.withMode(AcquisitionMode.parse(cmd.getOptionValue("mode")));
        }
        if (cmd.hasOption("days")) {
            settings = settings.withDays(parsePositive(cmd.getOptionValue("days"), "days"));
        }
        settings = settings.withMarket(
                firstNonBlank(cmd.getOptionValue("exchange"), settings.exchange()),
                firstNonBlank(cmd.getOptionValue("interval"), settings.interval())
        );
        return settings.withDryRun(cmd.hasOption("dry-run"));
    }

    static List<String> resolveSymbols(CommandLine cmd, Config config) {
        List<String> symbols = cmd.hasOption("symbols")
                ? splitList(cmd.getOptionValue("symbols"))
                : config.getList("crypto.symbols");
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("no symbols given (use --symbols or crypto.symbols)");
        }
        return symbols;
    }

    static List<String> resolveFreshnessSymbols(CommandLine cmd, List<CryptoAsset> assets, CryptoRegistry registry) {
        List<CryptoAsset> source = cmd.hasOption("all") ? registry.all() : assets;
        List<String> symbols = new ArrayList<>();
        for (CryptoAsset asset : source) {
            symbols.add(asset.symbol);
        }
        return symbols;
    }

    static List<PivotType> resolvePivotTypes(Config config) {
        List<PivotType> types = new ArrayList<>();
        for (String raw : config.getList("indicators.pivot.types")) {
            PivotType type = PivotType.fromLabel(raw);
            if (!types.contains(type)) {
                types.add(type);
            }
        }
        return types.isEmpty() ? List.of(PivotType.CLASSIC) : types;
    }

    private static void writeJson(Path out, List<TechnicalAnalysisRecord> records) throws IOException {
        JSONArray array = new JSONArray();
        for (TechnicalAnalysisRecord record : records) {
            array.put(RecordJson.toJson(record));
        }
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(out, array.toString(2), StandardCharsets.UTF_8);
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("symbols").hasArg().argName("list").desc("comma separated symbols, e.g. BTC,ETH (default: crypto.symbols)").build());
        options.addOption(Option.builder().longOpt("mode").hasArg().argName("local|remote").desc("remote indicator API or local computation from OHLC (default: batch.mode)").build());
        options.addOption(Option.builder().longOpt("days").hasArg().argName("n").desc("OHLC days for local mode: 1, 7, 14, 30, 90, 180 or 365").build());
        options.addOption(Option.builder().longOpt("exchange").hasArg().argName("name").desc("exchange for remote indicators (default: taapi.exchange)").build());
        options.addOption(Option.builder().longOpt("interval").hasArg().argName("interval").desc("candle interval for remote indicators (default: taapi.interval)").build());
        options.addOption(Option.builder().longOpt("dry-run").desc("analyze without writing to the database").build());
        options.addOption(Option.builder().longOpt("latest").hasArg().argName("n").desc("print the latest n stored records and exit").build());
        options.addOption(Option.builder().longOpt("freshness").desc("report the age of the newest stored record per symbol and exit").build());
        options.addOption(Option.builder().longOpt("all").desc("with --freshness: check every supported symbol").build());
        options.addOption(Option.builder().longOpt("json").desc("with --freshness: print the report as JSON").build());
        options.addOption(Option.builder().longOpt("out").hasArg().argName("file").desc("write the records as JSON to a file").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private static int parsePositive(String raw, String name) {
        try {
            int value = Integer.parseInt(raw == null ? "" : raw.trim());
            if (value <= 0) {
                throw new IllegalArgumentException("--" + name + " must be positive: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number: " + raw, e);
        }
    }

    private static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String token : Arrays.asList(raw.split("[,;\\s]+"))) {
            String trimmed = token.trim().toUpperCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    private static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
