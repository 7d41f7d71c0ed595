package com.loanauction.model;

import java.time.Instant;

/**
 * Lifecycle stage of an auction. Phases only move forward:
 * PENDING, then ACTIVE, then CLOSED.
 */
public enum AuctionPhase {
    PENDING,
    ACTIVE,
    CLOSED;

    /** Phase implied by the clock alone. */
    public static AuctionPhase at(Instant now, Instant startTime, Instant endTime) {
        if (!now.isBefore(endTime)) {
            return CLOSED;
        }
        if (!now.isBefore(startTime)) {
            return ACTIVE;
        }
        return PENDING;
    }

    /** Returns the later of this phase and {@code target}. */
    public AuctionPhase advanceTo(AuctionPhase target) {
        return target.ordinal() > ordinal() ? target : this;
    }

    public boolean isBefore(AuctionPhase other) {
        return ordinal() < other.ordinal();
    }
}
