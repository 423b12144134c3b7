package com.cryptobot.ta.remote;

import java.time.Duration;
import java.util.Objects;

/**
 * Spaces out remote calls so that consecutive grants are at least {@code delay} apart.
 * The first call is granted at once. Not thread-safe: one instance per sequential caller.
 */
public final class RateLimiter {
    private final Duration delay;
    private final MonotonicClock clock;
    private long lastGrantNanos;
    private boolean granted;
    private int grantedSlots;

    public RateLimiter(Duration delay) {
        this(delay, MonotonicClock.system());
    }

    public RateLimiter(Duration delay, MonotonicClock clock) {
        this.delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void waitForSlot() throws InterruptedException {
        long delayNanos = delay.toNanos();
        if (granted && delayNanos > 0L) {
            while (true) {
                long now = clock.nanoTime();
                long nextAllowed = lastGrantNanos + delayNanos;
                if (now >= nextAllowed) {
                    break;
                }
                clock.sleep(Duration.ofNanos(nextAllowed - now));
            }
        }
        lastGrantNanos = clock.nanoTime();
        granted = true;
        grantedSlots++;
    }

    public Duration delay() {
        return delay;
    }

    public int grantedSlots() {
        return grantedSlots;
    }
}
