package com.cryptobot.ta.indicator;

import java.util.Arrays;

/**
 * Series functions over price arrays, oldest value first. Each function returns a series
 * of the input length; positions without enough history hold {@code NaN}.
 */
public final class IndicatorMath {
    private IndicatorMath() {
    }

    public static double last(double[] series) {
        return series.length == 0 ? Double.NaN : series[series.length - 1];
    }

    public static double[] sma(double[] values, int period) {
        double[] out = nanSeries(values.length);
        if (period <= 0) {
            return out;
        }
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= period) {
                sum -= values[i - period];
            }
            if (i >= period - 1) {
                out[i] = sum / period;
            }
        }
        return out;
    }

    /**
     * Exponential average seeded with the first value, so it is defined from index 0.
     * NaN inputs (leading gaps) are skipped until the first real value.
     */
    public static double[] ema(double[] values, int period) {
        double[] out = nanSeries(values.length);
        double alpha = 2.0 / (period + 1.0);
        double prev = Double.NaN;
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (Double.isNaN(value)) {
                continue;
            }
            prev = Double.isNaN(prev) ? value : prev + alpha * (value - prev);
            out[i] = prev;
        }
        return out;
    }

    /**
     * Wilder RSI. No movement at all reads 50, gains without losses read 100.
     */
    public static double[] rsi(double[] closes, int period) {
        double[] out = nanSeries(closes.length);
        if (closes.length <= period) {
            return out;
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double diff = closes[i] - closes[i - 1];
            if (diff > 0) {
                gain += diff;
            } else {
                loss -= diff;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        out[period] = rsiValue(avgGain, avgLoss);

        for (int i = period + 1; i < closes.length; i++) {
            double diff = closes[i] - closes[i - 1];
            double currentGain = diff > 0 ? diff : 0.0;
            double currentLoss = diff < 0 ? -diff : 0.0;
            avgGain = (avgGain * (period - 1) + currentGain) / period;
            avgLoss = (avgLoss * (period - 1) + currentLoss) / period;
            out[i] = rsiValue(avgGain, avgLoss);
        }
        return out;
    }

    private static double rsiValue(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    /**
     * Stochastic RSI %K scaled to 0..100. A window with a flat RSI reads 50.
     */
    public static double[] stochRsiK(double[] closes, int rsiPeriod, int stochPeriod, int smoothK) {
        double[] rsi = rsi(closes, rsiPeriod);
        double[] stoch = nanSeries(closes.length);
        for (int i = rsiPeriod + stochPeriod - 1; i < closes.length; i++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int j = i - stochPeriod + 1; j <= i; j++) {
                min = Math.min(min, rsi[j]);
                max = Math.max(max, rsi[j]);
            }
            stoch[i] = max == min ? 0.5 : (rsi[i] - min) / (max - min);
        }
        double[] k = smaSkippingNaN(stoch, smoothK);
        for (int i = 0; i < k.length; i++) {
            k[i] = k[i] * 100.0;
        }
        return k;
    }

    /**
     * Wilder ATR: mean of the first {@code period} true ranges, then smoothed.
     */
    public static double[] atr(double[] highs, double[] lows, double[] closes, int period) {
        int size = closes.length;
        double[] out = nanSeries(size);
        if (size < period || period <= 0) {
            return out;
        }
        double[] tr = new double[size];
        for (int i = 0; i < size; i++) {
            double range = highs[i] - lows[i];
            if (i == 0) {
                tr[i] = range;
                continue;
            }
            double prevClose = closes[i - 1];
            tr[i] = Math.max(range, Math.max(Math.abs(highs[i] - prevClose), Math.abs(lows[i] - prevClose)));
        }
        double sum = 0.0;
        for (int i = 0; i < period; i++) {
            sum += tr[i];
        }
        double atr = sum / period;
        out[period - 1] = atr;
        for (int i = period; i < size; i++) {
            atr = (atr * (period - 1) + tr[i]) / period;
            out[i] = atr;
        }
        return out;
    }

    /**
     * Bollinger band of the last window with population standard deviation.
     * Returns {upper, middle, lower}.
     */
    public static double[] bollinger(double[] closes, int period, double k) {
        if (closes.length < period) {
            double last = last(closes);
            return new double[]{last, last, last};
        }
        double mean = last(sma(closes, period));
        double sumSq = 0.0;
        for (int i = closes.length - period; i < closes.length; i++) {
            double d = closes[i] - mean;
            sumSq += d * d;
        }
        double stdev = Math.sqrt(sumSq / period);
        return new double[]{mean + k * stdev, mean, mean - k * stdev};
    }

    public static double[] obv(double[] closes, double[] volumes) {
        double[] out = new double[closes.length];
        for (int i = 1; i < closes.length; i++) {
            if (closes[i] > closes[i - 1]) {
                out[i] = out[i - 1] + volumes[i];
            } else if (closes[i] < closes[i - 1]) {
                out[i] = out[i - 1] - volumes[i];
            } else {
                out[i] = out[i - 1];
            }
        }
        return out;
    }

    /**
     * Rolling volume-weighted typical price. A window without volume falls back to the
     * plain mean of the typical price.
     */
    public static double[] vwap(double[] highs, double[] lows, double[] closes, double[] volumes, int window) {
        int size = closes.length;
        double[] out = nanSeries(size);
        for (int i = window - 1; i < size; i++) {
            double pv = 0.0;
            double vol = 0.0;
            double tpSum = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                double tp = (highs[j] + lows[j] + closes[j]) / 3.0;
                pv += tp * volumes[j];
                vol += volumes[j];
                tpSum += tp;
            }
            out[i] = vol == 0.0 ? tpSum / window : pv / vol;
        }
        return out;
    }

    /**
     * Chaikin money flow. A candle with zero range contributes no flow.
     */
    public static double[] cmf(double[] highs, double[] lows, double[] closes, double[] volumes, int window) {
        int size = closes.length;
        double[] mfv = new double[size];
        for (int i = 0; i < size; i++) {
            double range = highs[i] - lows[i];
            double multiplier = range == 0.0 ? 0.0 : ((closes[i] - lows[i]) - (highs[i] - closes[i])) / range;
            mfv[i] = multiplier * volumes[i];
        }
        double[] out = nanSeries(size);
        for (int i = window - 1; i < size; i++) {
            double flow = 0.0;
            double vol = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                flow += mfv[j];
                vol += volumes[j];
            }
            out[i] = vol == 0.0 ? 0.0 : flow / vol;
        }
        return out;
    }

    /**
     * Returns {macd line, signal line, histogram} series.
     */
    public static double[][] macd(double[] closes, int fast, int slow, int signal) {
        double[] fastEma = ema(closes, fast);
        double[] slowEma = ema(closes, slow);
        double[] line = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            line[i] = fastEma[i] - slowEma[i];
        }
        double[] signalLine = ema(line, signal);
        double[] hist = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            hist[i] = line[i] - signalLine[i];
        }
        return new double[][]{line, signalLine, hist};
    }

    private static double[] smaSkippingNaN(double[] values, int period) {
        double[] out = nanSeries(values.length);
        for (int i = period - 1; i < values.length; i++) {
            double sum = 0.0;
            boolean complete = true;
            for (int j = i - period + 1; j <= i; j++) {
                if (Double.isNaN(values[j])) {
                    complete = false;
                    break;
                }
                sum += values[j];
            }
            if (complete) {
                out[i] = sum / period;
            }
        }
        return out;
    }

    private static double[] nanSeries(int size) {
        double[] out = new double[size];
        Arrays.fill(out, Double.NaN);
        return out;
    }
}
