package com.loanauction.time;

import java.time.Instant;

/**
 * Source of the current instant used for auction phase transitions
 * and bid timestamps.
 *
 * <p>Production code uses {@link SystemTimeSource}; tests substitute a
 * controllable implementation to move virtual time past start and end
 * instants.</p>
 */
public interface TimeSource {

    /**
     * @return the current instant, never {@code null}
     */
    Instant now();
}
