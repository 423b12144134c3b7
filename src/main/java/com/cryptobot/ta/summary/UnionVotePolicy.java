package com.cryptobot.ta.summary;

import com.cryptobot.ta.model.SummaryLabel;

/**
 * Re-votes over every signal of both sets with the ratio rule.
 */
public final class UnionVotePolicy implements OverallPolicy {
    public static final String NAME = "union-vote";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SummaryLabel overall(SignalTally indicators, SignalTally movingAverages,
                                SummaryLabel indicatorLabel, SummaryLabel movingAverageLabel) {
        SignalTally union = indicators.plus(movingAverages);
        return SummaryAggregator.label(union.bullish(), union.bearish(), union.total());
    }
}
