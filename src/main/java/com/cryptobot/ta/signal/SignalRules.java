package com.cryptobot.ta.signal;

import com.cryptobot.ta.model.Signal;

/**
 * Threshold rules turning raw indicator values into labels. Exact ties carry no direction
 * and read {@link Signal#NEUTRAL}.
 */
public final class SignalRules {
    public static final double RSI_OVERBOUGHT = 70.0;
    public static final double RSI_OVERSOLD = 30.0;
    public static final double STOCH_OVERBOUGHT = 80.0;
    public static final double STOCH_OVERSOLD = 20.0;
    public static final double ATR_HIGH_VOLATILITY_RATIO = 0.02;

    private SignalRules() {
    }

    public static Signal rsiZone(double rsi) {
        if (rsi > RSI_OVERBOUGHT) {
            return Signal.OVERBOUGHT;
        }
        if (rsi < RSI_OVERSOLD) {
            return Signal.OVERSOLD;
        }
        return Signal.NEUTRAL;
    }

    public static Signal rsiAdvice(double rsi) {
        if (rsi < RSI_OVERSOLD) {
            return Signal.BUY;
        }
        if (rsi > RSI_OVERBOUGHT) {
            return Signal.SELL;
        }
        return Signal.NEUTRAL;
    }

    public static Signal stochZone(double k) {
        if (k > STOCH_OVERBOUGHT) {
            return Signal.OVERBOUGHT;
        }
        if (k < STOCH_OVERSOLD) {
            return Signal.OVERSOLD;
        }
        return Signal.NEUTRAL;
    }

    public static Signal stochAdvice(double k) {
        if (k < STOCH_OVERSOLD) {
            return Signal.BUY;
        }
        if (k > STOCH_OVERBOUGHT) {
            return Signal.SELL;
        }
        return Signal.NEUTRAL;
    }

    public static Signal macd(double macd, double signalLine) {
        return compare(macd, signalLine, Signal.BUY, Signal.SELL);
    }

    public static Signal bollinger(double price, double upper, double lower) {
        if (upper <= lower) {
            return Signal.NEUTRAL;
        }
        if (price >= upper) {
            return Signal.OVERBOUGHT;
        }
        if (price <= lower) {
            return Signal.OVERSOLD;
        }
        return Signal.NEUTRAL;
    }

    public static Signal obvTrend(double current, double previous) {
        return compare(current, previous, Signal.ACCUMULATION, Signal.DISTRIBUTION);
    }

    public static Signal obvSign(double value) {
        return compare(value, 0.0, Signal.ACCUMULATION, Signal.DISTRIBUTION);
    }

    public static Signal atr(double atr, double price) {
        if (price > 0 && atr > price * ATR_HIGH_VOLATILITY_RATIO) {
            return Signal.HIGH_VOLATILITY;
        }
        return Signal.LOW_VOLATILITY;
    }

    public static Signal vwap(double price, double vwap) {
        return compare(price, vwap, Signal.BULLISH, Signal.BEARISH);
    }

    public static Signal cmf(double value) {
        return compare(value, 0.0, Signal.BUYING_PRESSURE, Signal.SELLING_PRESSURE);
    }

    public static Signal movingAverage(double price, double average) {
        return compare(price, average, Signal.BUY, Signal.SELL);
    }

    private static Signal compare(double value, double reference, Signal above, Signal below) {
        if (value > reference) {
            return above;
        }
        if (value < reference) {
            return below;
        }
        return Signal.NEUTRAL;
    }
}
