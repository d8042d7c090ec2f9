package com.example.inkbatch;

import java.time.Duration;

/**
 * Blocks the calling worker between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Production sleeper backed by {@link Thread#sleep(long, int)}; only the calling thread waits.
     */
    Sleeper THREAD = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        }
    };
}
