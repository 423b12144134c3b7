package com.cryptobot.ta.summary;

import com.cryptobot.ta.model.IndicatorResult;
import com.cryptobot.ta.model.MovingAverageResult;
import com.cryptobot.ta.model.SummaryLabel;
import com.cryptobot.ta.model.SummaryTriplet;

import java.util.List;
import java.util.Objects;

public final class SummaryAggregator {
    public static final double STRONG_RATIO = 0.7;
    public static final double MAJORITY_RATIO = 0.5;

    private final OverallPolicy policy;
    private final VoteCounting counting;

    public SummaryAggregator(OverallPolicy policy, VoteCounting counting) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.counting = Objects.requireNonNull(counting, "counting");
    }

    public OverallPolicy policy() {
        return policy;
    }

    public VoteCounting counting() {
        return counting;
    }

    public SummaryTriplet summarize(List<IndicatorResult> indicators, List<MovingAverageResult> movingAverages) {
        SignalTally indicatorTally = SignalTally.ofIndicators(indicators, counting);
        SignalTally maTally = SignalTally.ofMovingAverages(movingAverages, counting);
        SummaryLabel indicatorLabel = label(indicatorTally);
        SummaryLabel maLabel = label(maTally);
        SummaryLabel overall = policy.overall(indicatorTally, maTally, indicatorLabel, maLabel);
        return new SummaryTriplet(overall, indicatorLabel, maLabel);
    }

    public static SummaryLabel label(SignalTally tally) {
        return label(tally.bullish(), tally.bearish(), tally.total());
    }

    /**
     * Ratio vote: 70% one way is Strong, 50% is a plain lean, anything else Neutral.
     * Bullish thresholds are checked first.
     */
    public static SummaryLabel label(int buy, int sell, int total) {
        if (total <= 0) {
            return SummaryLabel.NEUTRAL;
        }
        double buyRatio = (double) buy / total;
        double sellRatio = (double) sell / total;
        if (buyRatio >= STRONG_RATIO) {
            return SummaryLabel.STRONG_BUY;
        }
        if (buyRatio >= MAJORITY_RATIO) {
            return SummaryLabel.BUY;
        }
        if (sellRatio >= STRONG_RATIO) {
            return SummaryLabel.STRONG_SELL;
        }
        if (sellRatio >= MAJORITY_RATIO) {
            return SummaryLabel.SELL;
        }
        return SummaryLabel.NEUTRAL;
    }
}
