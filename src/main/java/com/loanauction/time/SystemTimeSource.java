package com.loanauction.time;

import java.time.Clock;
import java.time.Instant;

/**
 * {@link TimeSource} backed by a {@link Clock}, UTC system clock by default.
 */
public final class SystemTimeSource implements TimeSource {

    private final Clock clock;

    public SystemTimeSource() {
        this(Clock.systemUTC());
    }

    public SystemTimeSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
