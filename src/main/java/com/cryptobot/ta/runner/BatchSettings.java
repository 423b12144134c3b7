package com.cryptobot.ta.runner;

import com.cryptobot.ta.config.Config;

import java.time.Duration;

public record BatchSettings(
        AcquisitionMode mode,
        String exchange,
        String interval,
        int days,
        Duration rateLimitDelay,
        int maxRetries,
        Duration retryDelay,
        Duration symbolCooldown,
        boolean dryRun
) {
    public static BatchSettings fromConfig(Config config) {
        return new BatchSettings(
                AcquisitionMode.parse(config.getString("batch.mode", "remote")),
                config.getString("taapi.exchange", "binance"),
                config.getString("taapi.interval", "1h"),
                config.getInt("coingecko.ohlc_days", 30),
                Duration.ofSeconds(Math.max(0L, config.getLong("taapi.rate_limit_delay_sec", 18L))),
                Math.max(0, config.getInt("fetch.max_retries", 5)),
                Duration.ofSeconds(Math.max(0L, config.getLong("fetch.retry_delay_sec", 30L))),
                Duration.ofSeconds(Math.max(0L, config.getLong("batch.symbol_cooldown_sec", 5L))),
                false
        );
    }

    public BatchSettings withMode(AcquisitionMode value) {
        return new BatchSettings(value, exchange, interval, days, rateLimitDelay, maxRetries, retryDelay, symbolCooldown, dryRun);
    }

    public BatchSettings withMarket(String exchangeValue, String intervalValue) {
        return new BatchSettings(mode, exchangeValue, intervalValue, days, rateLimitDelay, maxRetries, retryDelay, symbolCooldown, dryRun);
    }

    public BatchSettings withDays(int value) {
        return new BatchSettings(mode, exchange, interval, value, rateLimitDelay, maxRetries, retryDelay, symbolCooldown, dryRun);
    }

    public BatchSettings withDryRun(boolean value) {
        return new BatchSettings(mode, exchange, interval, days, rateLimitDelay, maxRetries, retryDelay, symbolCooldown, value);
    }
}
