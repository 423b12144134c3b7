package com.cryptobot.ta.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration.
 * Lookup order: environment override, ./config.properties, classpath config.properties, built-in defaults.
 */
public final class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();
    private static final Map<String, String> ENV_OVERRIDES = buildEnvOverrides();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Map<String, String> envProps = new HashMap<>();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, System.getenv());
    }

    public static Config load(Path workingDir, Map<String, String> env) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            log.warn("Failed to read classpath config.properties, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                log.warn("Failed to read {}: {}", local, e.getMessage());
            }
        }

        config.applyEnv(env);
        return config;
    }

    /**
     * Builds a config from explicit values only, on top of the defaults.
     */
    public static Config of(Map<String, String> values) {
        Config config = new Config(Path.of("."));
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    config.overrideProps.setProperty(entry.getKey(), entry.getValue());
                }
            }
            config.props.putAll(config.overrideProps);
        }
        return config;
    }

    private void applyEnv(Map<String, String> env) {
        if (env == null) {
            return;
        }
        for (Map.Entry<String, String> mapping : ENV_OVERRIDES.entrySet()) {
            String value = nonBlank(env.get(mapping.getKey()));
            if (!value.isEmpty()) {
                envProps.put(mapping.getValue(), value);
                props.setProperty(mapping.getValue(), value);
            }
        }
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        String value = getString(key);
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(key == null ? "" : key, getString(key), sourceOf(key));
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (envProps.containsKey(key)) {
            return "env";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private static String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildEnvOverrides() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("TAAPI_API_KEY", "taapi.api_key");
        env.put("COINGECKO_API_KEY", "coingecko.api_key");
        env.put("CRYPTOBOT_DB_URL", "db.url");
        env.put("CRYPTOBOT_DB_USER", "db.user");
        env.put("CRYPTOBOT_DB_PASS", "db.pass");
        env.put("SUPPORTED_CRYPTOS", "crypto.symbols");
        return Collections.unmodifiableMap(env);
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("db.enabled", "true");
        defaults.put("db.url", "jdbc:postgresql://localhost:5432/cryptobot");
        defaults.put("db.user", "cryptobot");
        defaults.put("db.pass", "cryptobot");
        defaults.put("db.schema", "public");

        defaults.put("crypto.symbols", "BTC,ETH,SOL");

        defaults.put("taapi.base_url", "https://api.taapi.io");
        defaults.put("taapi.api_key", "");
        defaults.put("taapi.exchange", "binance");
        defaults.put("taapi.interval", "1h");
        defaults.put("taapi.request_timeout_sec", "30");
        defaults.put("taapi.rate_limit_delay_sec", "18");
        defaults.put("taapi.source_url", "https://taapi.io");
        defaults.put("taapi.price_source", "coingecko");

        defaults.put("coingecko.base_url", "https://api.coingecko.com/api/v3");
        defaults.put("coingecko.api_key", "");
        defaults.put("coingecko.request_timeout_sec", "30");
        defaults.put("coingecko.ohlc_days", "30");
        defaults.put("coingecko.source_url", "https://www.coingecko.com");

        defaults.put("fetch.max_retries", "5");
        defaults.put("fetch.retry_delay_sec", "30");

        defaults.put("indicators.pivot.types", "Classic");
        defaults.put("indicators.min_candles", "50");

        defaults.put("batch.symbol_cooldown_sec", "5");
        defaults.put("batch.mode", "remote");

        defaults.put("freshness.fresh_minutes", "60");
        defaults.put("freshness.acceptable_minutes", "120");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
