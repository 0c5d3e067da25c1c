package com.ensemblslicer.runner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Clock that only moves when told to. Its {@link #sleeper()} advances the clock instead of blocking.
 */
class ManualClock extends Clock {
    private Instant now;
    final List<Duration> sleeps = new ArrayList<>();
    Runnable onSleep = () -> {};

    ManualClock() {
        this(Instant.parse("2024-05-01T10:00:00Z"));
    }

    ManualClock(Instant start) {
        this.now = start;
    }

    void advance(Duration d) {
        now = now.plus(d);
    }

    Sleeper sleeper() {
        return d -> {
            sleeps.add(d);
            advance(d);
            onSleep.run();
        };
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now;
    }
}
