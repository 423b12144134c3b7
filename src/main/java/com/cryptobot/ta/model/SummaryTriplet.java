package com.cryptobot.ta.model;

import java.util.Objects;

public record SummaryTriplet(
        SummaryLabel overall,
        SummaryLabel technicalIndicators,
        SummaryLabel movingAverages
) {
    public SummaryTriplet {
        Objects.requireNonNull(overall, "overall");
        Objects.requireNonNull(technicalIndicators, "technicalIndicators");
        Objects.requireNonNull(movingAverages, "movingAverages");
    }

    public static SummaryTriplet neutral() {
        return new SummaryTriplet(SummaryLabel.NEUTRAL, SummaryLabel.NEUTRAL, SummaryLabel.NEUTRAL);
    }
}
