package com.cryptobot.ta.indicator;

import com.cryptobot.ta.model.IndicatorResult;
import com.cryptobot.ta.model.MovingAverageResult;
import com.cryptobot.ta.model.PivotSet;

import java.util.List;

/**
 * Everything computed from one candle series, before summaries are attached.
 */
public final class IndicatorSet {
    public final List<IndicatorResult> indicators;
    public final List<MovingAverageResult> movingAverages;
    public final List<PivotSet> pivots;
    public final double lastClose;
    public final double previousClose;
    public final int dataPoints;

    public IndicatorSet(
            List<IndicatorResult> indicators,
            List<MovingAverageResult> movingAverages,
            List<PivotSet> pivots,
            double lastClose,
            double previousClose,
            int dataPoints
    ) {
        this.indicators = List.copyOf(indicators);
        this.movingAverages = List.copyOf(movingAverages);
        this.pivots = List.copyOf(pivots);
        this.lastClose = lastClose;
        this.previousClose = previousClose;
        this.dataPoints = dataPoints;
    }
}
