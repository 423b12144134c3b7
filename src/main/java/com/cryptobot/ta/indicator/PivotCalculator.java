package com.cryptobot.ta.indicator;

import com.cryptobot.ta.model.Candle;
import com.cryptobot.ta.model.PivotSet;
import com.cryptobot.ta.model.PivotType;

import java.util.ArrayList;
import java.util.List;

/**
 * Floor pivots from the previous (completed) candle.
 */
public final class PivotCalculator {
    private final List<PivotType> types;

    public PivotCalculator() {
        this(List.of(PivotType.CLASSIC));
    }

    public PivotCalculator(List<PivotType> types) {
        this.types = types == null || types.isEmpty() ? List.of(PivotType.CLASSIC) : List.copyOf(types);
    }

    public List<PivotSet> compute(List<Candle> candles) {
        if (candles == null || candles.size() < 2) {
            return List.of();
        }
        Candle previous = candles.get(candles.size() - 2);
        List<PivotSet> out = new ArrayList<>(types.size());
        for (PivotType type : types) {
            out.add(compute(type, previous.high, previous.low, previous.close));
        }
        return out;
    }

    public static PivotSet compute(PivotType type, double high, double low, double close) {
        double range = high - low;
        switch (type) {
            case FIBONACCI: {
                double p = (high + low + close) / 3.0;
                return new PivotSet(type, p,
                        p + 0.382 * range, p + 0.618 * range, p + range,
                        p - 0.382 * range, p - 0.618 * range, p - range);
            }
            case CAMARILLA: {
                double p = (high + low + close) / 3.0;
                return new PivotSet(type, p,
                        close + range * 1.1 / 12.0, close + range * 1.1 / 6.0, close + range * 1.1 / 4.0,
                        close - range * 1.1 / 12.0, close - range * 1.1 / 6.0, close - range * 1.1 / 4.0);
            }
            case WOODIE: {
                double p = (high + low + 2.0 * close) / 4.0;
                return new PivotSet(type, p,
                        2.0 * p - low, p + range, high + 2.0 * (p - low),
                        2.0 * p - high, p - range, low - 2.0 * (high - p));
            }
            case CLASSIC:
            default: {
                double p = (high + low + close) / 3.0;
                return new PivotSet(PivotType.CLASSIC, p,
                        2.0 * p - low, p + range, high + 2.0 * (p - low),
                        2.0 * p - high, p - range, low - 2.0 * (high - p));
            }
        }
    }
}
