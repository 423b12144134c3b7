package com.cryptobot.ta.indicator;

import com.cryptobot.ta.error.InsufficientDataException;
import com.cryptobot.ta.model.BandIndicator;
import com.cryptobot.ta.model.Candle;
import com.cryptobot.ta.model.IndicatorResult;
import com.cryptobot.ta.model.IndicatorType;
import com.cryptobot.ta.model.MovingAverageResult;
import com.cryptobot.ta.model.PivotType;
import com.cryptobot.ta.model.ScalarIndicator;
import com.cryptobot.ta.model.Signal;
import com.cryptobot.ta.model.SignalDirection;
import com.cryptobot.ta.model.TrendIndicator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndicatorComputerTest {

    @Test
    void compute_flatSeriesReadsNeutralEverywhere() {
        IndicatorSet set = new IndicatorComputer().compute(TestCandles.flat(60, 100.0));

        assertEquals(9, set.indicators.size());
        assertEquals(IndicatorType.canonicalOrder(), types(set.indicators));
        assertEquals(60, set.dataPoints);
        assertEquals(100.0, set.lastClose, 1e-9);

        ScalarIndicator rsi = (ScalarIndicator) set.indicators.get(0);
        assertEquals(50.0, rsi.value(), 1e-9);
        assertSame(Signal.NEUTRAL, rsi.signal());

        BandIndicator band = (BandIndicator) set.indicators.get(2);
        assertEquals(100.0, band.upper(), 1e-9);
        assertEquals(100.0, band.middle(), 1e-9);
        assertEquals(100.0, band.lower(), 1e-9);
        assertSame(Signal.NEUTRAL, band.signal());

        ScalarIndicator stoch = (ScalarIndicator) set.indicators.get(4);
        assertEquals(50.0, stoch.value(), 1e-9);

        ScalarIndicator atr = (ScalarIndicator) set.indicators.get(5);
        assertEquals(0.0, atr.value(), 1e-9);
        assertSame(Signal.LOW_VOLATILITY, atr.signal());

        for (IndicatorResult indicator : set.indicators) {
            assertTrue(indicator.signal().direction() == SignalDirection.NEUTRAL,
                    indicator.name() + " was " + indicator.signal());
        }
        assertEquals(3, set.movingAverages.size());
        for (MovingAverageResult ma : set.movingAverages) {
            assertEquals(100.0, ma.value, 1e-9);
            assertSame(Signal.NEUTRAL, ma.signal);
        }
    }

    @Test
    void compute_superTrendIsReportedAsNotApplicable() {
        IndicatorSet set = new IndicatorComputer().compute(TestCandles.wave(80));

        TrendIndicator superTrend = (TrendIndicator) set.indicators.get(7);
        assertSame(IndicatorType.SUPERTREND, superTrend.type());
        assertTrue(superTrend.notApplicable());
        assertEquals("N/A", superTrend.trend());
        assertTrue(Double.isNaN(superTrend.value()));
    }

    @Test
    void compute_risingSeriesSignalsMomentum() {
        IndicatorSet set = new IndicatorComputer().compute(TestCandles.rising(60, 100.0, 1.0));

        ScalarIndicator rsi = (ScalarIndicator) set.indicators.get(0);
        assertEquals(100.0, rsi.value(), 1e-9);
        assertSame(Signal.OVERBOUGHT, rsi.signal());
        assertSame(Signal.BUY, set.indicators.get(1).signal());
        assertSame(Signal.ACCUMULATION, set.indicators.get(3).signal());
        assertSame(Signal.BULLISH, set.indicators.get(6).signal());
        for (MovingAverageResult ma : set.movingAverages) {
            assertSame(Signal.BUY, ma.signal, ma.name());
            assertTrue(ma.value < set.lastClose);
        }
    }

    @Test
    void compute_isDeterministic() {
        List<Candle> candles = TestCandles.wave(120);
        IndicatorComputer computer = new IndicatorComputer(List.of(PivotType.CLASSIC, PivotType.CAMARILLA));

        IndicatorSet first = computer.compute(candles);
        IndicatorSet second = computer.compute(new ArrayList<>(candles));

        for (int i = 0; i < first.indicators.size(); i++) {
            assertSame(first.indicators.get(i).signal(), second.indicators.get(i).signal());
        }
        assertEquals(((ScalarIndicator) first.indicators.get(0)).value(),
                ((ScalarIndicator) second.indicators.get(0)).value());
        assertEquals(first.movingAverages.get(2).value, second.movingAverages.get(2).value);
        assertEquals(first.pivots.get(1).r3, second.pivots.get(1).r3);
    }

    @Test
    void compute_oscillatorsStayWithinRange() {
        for (int count : new int[]{50, 73, 200}) {
            IndicatorSet set = new IndicatorComputer().compute(TestCandles.wave(count));
            double rsi = ((ScalarIndicator) set.indicators.get(0)).value();
            double stoch = ((ScalarIndicator) set.indicators.get(4)).value();
            assertTrue(rsi >= 0.0 && rsi <= 100.0, "rsi " + rsi);
            assertTrue(stoch >= 0.0 && stoch <= 100.0, "stoch " + stoch);
        }
    }

    @Test
    void compute_shouldRejectShortSeries() {
        InsufficientDataException error = assertThrows(InsufficientDataException.class,
                () -> new IndicatorComputer().compute(TestCandles.flat(49, 100.0)));

        assertEquals(50, error.required());
        assertEquals(49, error.actual());
    }

    @Test
    void compute_pivotsUseThePreviousCandle() {
        List<Candle> candles = new ArrayList<>(TestCandles.flat(58, 100.0));
        candles.add(new Candle(1L, 100.0, 110.0, 90.0, 100.0));
        candles.add(new Candle(2L, 100.0, 500.0, 10.0, 300.0));

        IndicatorSet set = new IndicatorComputer().compute(candles);

        assertEquals(1, set.pivots.size());
        assertEquals(100.0, set.pivots.get(0).pivot, 1e-9);
        assertEquals(110.0, set.pivots.get(0).r1, 1e-9);
        assertEquals(100.0, set.previousClose, 1e-9);
    }

    private static List<IndicatorType> types(List<IndicatorResult> indicators) {
        List<IndicatorType> out = new ArrayList<>();
        for (IndicatorResult indicator : indicators) {
            out.add(indicator.type());
        }
        return out;
    }
}
