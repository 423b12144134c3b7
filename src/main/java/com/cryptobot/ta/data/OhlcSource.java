package com.cryptobot.ta.data;

import com.cryptobot.ta.model.Candle;

import java.util.List;
import java.util.Set;

public interface OhlcSource {
    Set<Integer> VALID_DAYS = Set.of(1, 7, 14, 30, 90, 180, 365);

    /**
     * Candles oldest first. {@code days} must be one of {@link #VALID_DAYS}.
     */
    List<Candle> getOhlc(String symbol, int days);
}
