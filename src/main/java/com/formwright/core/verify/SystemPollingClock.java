package com.formwright.core.verify;

import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class SystemPollingClock implements PollingClock {

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting", e);
        }
    }
}
