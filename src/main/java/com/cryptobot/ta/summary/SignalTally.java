package com.cryptobot.ta.summary;

import com.cryptobot.ta.model.IndicatorResult;
import com.cryptobot.ta.model.MovingAverageResult;
import com.cryptobot.ta.model.Signal;

import java.util.ArrayList;
import java.util.List;

/**
 * Vote counts over a set of signals. The total is the size of the set, so the N/A marker
 * counts as a non-directional entry.
 */
public record SignalTally(int bullish, int bearish, int total) {

    public static SignalTally ofIndicators(List<IndicatorResult> indicators, VoteCounting counting) {
        List<Signal> signals = new ArrayList<>(indicators.size());
        for (IndicatorResult result : indicators) {
            signals.add(result.signal());
        }
        return of(signals, counting);
    }

    public static SignalTally ofMovingAverages(List<MovingAverageResult> movingAverages, VoteCounting counting) {
        List<Signal> signals = new ArrayList<>(movingAverages.size());
        for (MovingAverageResult ma : movingAverages) {
            signals.add(ma.signal);
        }
        return of(signals, counting);
    }

    public static SignalTally of(List<Signal> signals, VoteCounting counting) {
        int bullish = 0;
        int bearish = 0;
        for (Signal signal : signals) {
            if (counting.isBuy(signal)) {
                bullish++;
            } else if (counting.isSell(signal)) {
                bearish++;
            }
        }
        return new SignalTally(bullish, bearish, signals.size());
    }

    public SignalTally plus(SignalTally other) {
        return new SignalTally(bullish + other.bullish, bearish + other.bearish, total + other.total);
    }
}
