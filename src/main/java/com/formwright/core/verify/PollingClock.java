package com.formwright.core.verify;

import java.time.Duration;

/**
 * Time source for every bounded wait in the engine: re-prove polling, grace delays and
 * alignment expiry. Swapped for a manual clock in tests so nothing actually sleeps.
 */
public interface PollingClock {

    long nowMillis();

    void sleep(Duration duration);
}
