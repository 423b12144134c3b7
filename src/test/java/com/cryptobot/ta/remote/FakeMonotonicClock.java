package com.cryptobot.ta.remote;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Clock that only moves when slept on or advanced by hand.
 */
public final class FakeMonotonicClock implements MonotonicClock {
    public final List<Duration> sleeps = new ArrayList<>();
    private long now = 1_000_000_000L;

    @Override
    public long nanoTime() {
        return now;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        now += duration.toNanos();
    }

    public void advance(Duration duration) {
        now += duration.toNanos();
    }

    public Duration totalSlept() {
        Duration total = Duration.ZERO;
        for (Duration sleep : sleeps) {
            total = total.plus(sleep);
        }
        return total;
    }
}
