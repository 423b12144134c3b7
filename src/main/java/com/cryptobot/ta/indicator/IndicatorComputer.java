package com.cryptobot.ta.indicator;

import com.cryptobot.ta.error.InsufficientDataException;
import com.cryptobot.ta.model.BandIndicator;
import com.cryptobot.ta.model.Candle;
import com.cryptobot.ta.model.IndicatorResult;
import com.cryptobot.ta.model.IndicatorType;
import com.cryptobot.ta.model.MacdIndicator;
import com.cryptobot.ta.model.MovingAverageResult;
import com.cryptobot.ta.model.MovingAverageType;
import com.cryptobot.ta.model.PivotType;
import com.cryptobot.ta.model.ScalarIndicator;
import com.cryptobot.ta.model.TrendIndicator;
import com.cryptobot.ta.signal.SignalRules;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the indicator set from raw candles. Pure: the same candles always give the
 * same result. Volume-based indicators use {@link VolumeProxy}.
 */
public final class IndicatorComputer {
    public static final int MIN_CANDLES = 50;

    private static final int RSI_PERIOD = 14;
    private static final int MACD_FAST = 12;
    private static final int MACD_SLOW = 26;
    private static final int MACD_SIGNAL = 9;
    private static final int BB_PERIOD = 20;
    private static final double BB_STDDEV = 2.0;
    private static final int STOCH_PERIOD = 14;
    private static final int STOCH_SMOOTH = 3;
    private static final int ATR_PERIOD = 14;
    private static final int VWAP_WINDOW = 14;
    private static final int CMF_WINDOW = 20;

    private final PivotCalculator pivotCalculator;
    private final int minCandles;

    public IndicatorComputer() {
        this(List.of(PivotType.CLASSIC));
    }

    public IndicatorComputer(List<PivotType> pivotTypes) {
        this(pivotTypes, MIN_CANDLES);
    }

    public IndicatorComputer(List<PivotType> pivotTypes, int minCandles) {
        this.pivotCalculator = new PivotCalculator(pivotTypes);
        this.minCandles = Math.max(MIN_CANDLES, minCandles);
    }

    public IndicatorSet compute(List<Candle> candles) {
        int size = candles == null ? 0 : candles.size();
        if (size < minCandles) {
            throw new InsufficientDataException(minCandles, size);
        }

        double[] closes = new double[size];
        double[] highs = new double[size];
        double[] lows = new double[size];
        for (int i = 0; i < size; i++) {
            Candle candle = candles.get(i);
            closes[i] = candle.close;
            highs[i] = candle.high;
            lows[i] = candle.low;
        }
        double[] volumes = VolumeProxy.series(candles);
        double price = closes[size - 1];

        List<IndicatorResult> indicators = new ArrayList<>(IndicatorType.values().length);

        double rsi = IndicatorMath.last(IndicatorMath.rsi(closes, RSI_PERIOD));
        indicators.add(new ScalarIndicator(IndicatorType.RSI, rsi, SignalRules.rsiZone(rsi)));

        double[][] macd = IndicatorMath.macd(closes, MACD_FAST, MACD_SLOW, MACD_SIGNAL);
        double macdLine = IndicatorMath.last(macd[0]);
        double signalLine = IndicatorMath.last(macd[1]);
        indicators.add(new MacdIndicator(IndicatorType.MACD, macdLine, IndicatorMath.last(macd[2]),
                SignalRules.macd(macdLine, signalLine)));

        double[] band = IndicatorMath.bollinger(closes, BB_PERIOD, BB_STDDEV);
        indicators.add(new BandIndicator(IndicatorType.BOLLINGER_BANDS, band[0], band[1], band[2],
                SignalRules.bollinger(price, band[0], band[2])));

        double[] obv = IndicatorMath.obv(closes, volumes);
        double obvNow = obv[size - 1];
        indicators.add(new ScalarIndicator(IndicatorType.OBV, obvNow, SignalRules.obvTrend(obvNow, obv[size - 2])));

        double stochK = IndicatorMath.last(IndicatorMath.stochRsiK(closes, RSI_PERIOD, STOCH_PERIOD, STOCH_SMOOTH));
        indicators.add(new ScalarIndicator(IndicatorType.STOCH_RSI, stochK, SignalRules.stochZone(stochK)));

        double atr = IndicatorMath.last(IndicatorMath.atr(highs, lows, closes, ATR_PERIOD));
        indicators.add(new ScalarIndicator(IndicatorType.ATR, atr, SignalRules.atr(atr, price)));

        double vwap = IndicatorMath.last(IndicatorMath.vwap(highs, lows, closes, volumes, VWAP_WINDOW));
        indicators.add(new ScalarIndicator(IndicatorType.VWAP, vwap, SignalRules.vwap(price, vwap)));

        // not computed locally, reported as an explicit N/A entry
        indicators.add(TrendIndicator.notApplicable(IndicatorType.SUPERTREND));

        double cmf = IndicatorMath.last(IndicatorMath.cmf(highs, lows, closes, volumes, CMF_WINDOW));
        indicators.add(new ScalarIndicator(IndicatorType.CMF, cmf, SignalRules.cmf(cmf)));

        List<MovingAverageResult> movingAverages = new ArrayList<>(MovingAverageResult.PERIODS.size());
        for (int period : MovingAverageResult.PERIODS) {
            double ema = IndicatorMath.last(IndicatorMath.ema(closes, period));
            movingAverages.add(new MovingAverageResult(period, MovingAverageType.EXPONENTIAL, ema,
                    SignalRules.movingAverage(price, ema)));
        }

        return new IndicatorSet(
                indicators,
                movingAverages,
                pivotCalculator.compute(candles),
                price,
                closes[size - 2],
                size
        );
    }
}
