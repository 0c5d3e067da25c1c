package com.ensemblslicer.runner;

import java.time.Duration;

/**
 * Suspends the calling thread between polls. Swapped for a clock-advancing fake in tests.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = d -> Thread.sleep(Math.max(0L, d.toMillis()));
}
