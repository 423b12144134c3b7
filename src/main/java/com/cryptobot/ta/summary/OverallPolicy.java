package com.cryptobot.ta.summary;

import com.cryptobot.ta.model.SummaryLabel;

/**
 * Derives the overall label from the two sub-summaries. The name is recorded in the
 * record metadata as {@code summaryPolicy}.
 */
public interface OverallPolicy {
    String name();

    SummaryLabel overall(SignalTally indicators, SignalTally movingAverages,
                         SummaryLabel indicatorLabel, SummaryLabel movingAverageLabel);
}
