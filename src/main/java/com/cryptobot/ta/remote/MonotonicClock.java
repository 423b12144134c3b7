package com.cryptobot.ta.remote;

import java.time.Duration;

/**
 * Time source for pacing remote calls. Tests swap in a fake that advances on sleep.
 */
public interface MonotonicClock {
    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;

    static MonotonicClock system() {
        return SystemMonotonicClock.INSTANCE;
    }
}
