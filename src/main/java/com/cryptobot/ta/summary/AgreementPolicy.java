package com.cryptobot.ta.summary;

import com.cryptobot.ta.model.SummaryLabel;

/**
 * Buy only when both sub-summaries lean bullish, Sell only when both lean bearish.
 * Never emits the Strong variants.
 */
public final class AgreementPolicy implements OverallPolicy {
    public static final String NAME = "agreement";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SummaryLabel overall(SignalTally indicators, SignalTally movingAverages,
                                SummaryLabel indicatorLabel, SummaryLabel movingAverageLabel) {
        if (indicatorLabel.isBullish() && movingAverageLabel.isBullish()) {
            return SummaryLabel.BUY;
        }
        if (indicatorLabel.isBearish() && movingAverageLabel.isBearish()) {
            return SummaryLabel.SELL;
        }
        return SummaryLabel.NEUTRAL;
    }
}
