package com.formwright.support;

import com.formwright.core.verify.PollingClock;

import java.time.Duration;

/**
 * Clock that only moves when someone sleeps on it or advances it by hand.
 */
public class ManualPollingClock implements PollingClock {

    private long now;
    private long slept;

    public ManualPollingClock() {
        this(1_000_000L);
    }

    public ManualPollingClock(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public long nowMillis() {
        return now;
    }

    @Override
    public void sleep(Duration duration) {
        if (!duration.isNegative()) {
            now += duration.toMillis();
            slept += duration.toMillis();
        }
    }

    public void advance(Duration duration) {
        now += duration.toMillis();
    }

    /** Total time spent in {@link #sleep}. */
    public long sleptMillis() {
        return slept;
    }
}
