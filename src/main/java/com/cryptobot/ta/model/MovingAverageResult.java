package com.cryptobot.ta.model;

import java.util.List;
import java.util.Objects;

public final class MovingAverageResult {
    public static final List<Integer> PERIODS = List.of(20, 50, 200);

    public final int period;
    public final MovingAverageType type;
    public final double value;
    public final Signal signal;

    public MovingAverageResult(int period, MovingAverageType type, double value, Signal signal) {
        if (!PERIODS.contains(period)) {
            throw new IllegalArgumentException("unsupported moving average period: " + period);
        }
        this.period = period;
        this.type = Objects.requireNonNull(type, "type");
        this.value = value;
        this.signal = Objects.requireNonNull(signal, "signal");
    }

    public String name() {
        return "MA" + period;
    }
}
