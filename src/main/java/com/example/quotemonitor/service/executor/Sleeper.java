package com.example.quotemonitor.service.executor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking wait, replaceable in tests so that retries and trigger waits
 * do not consume wall-clock time.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeper backed by the calling thread; returns at once for non-positive durations
     */
    static Sleeper threadSleeper() {
        return duration -> {
            if (duration.isNegative() || duration.isZero()) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        };
    }
}
