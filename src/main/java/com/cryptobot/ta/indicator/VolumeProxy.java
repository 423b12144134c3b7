package com.cryptobot.ta.indicator;

import com.cryptobot.ta.model.Candle;

import java.util.List;

/**
 * OHLC feeds carry no volume; volume-based indicators run on {@code (high - low) * close * 1000}.
 */
public final class VolumeProxy {
    public static final double SCALE = 1000.0;
    public static final String SOURCE_LABEL = "synthetic:(high-low)*close*1000";

    private VolumeProxy() {
    }

    public static double of(Candle candle) {
        return candle.range() * candle.close * SCALE;
    }

    public static double[] series(List<Candle> candles) {
        double[] out = new double[candles.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = of(candles.get(i));
        }
        return out;
    }
}
