package com.loanauction.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable auction snapshot. A new instance is built for every phase change
 * or close; the parameters fixed at creation are carried over unchanged.
 */
@Value
@Builder(toBuilder = true)
public class Auction {

    UUID id;
    String loanReference;
    String loanName;
    AuctionType auctionType;
    BigDecimal lotSize;
    BigDecimal minBid;
    BigDecimal bidIncrement;
    BigDecimal reservePrice;
    Instant startTime;
    Instant endTime;
    AuctionPhase phase;
    UUID winningBidId;
    String createdBy;
    Instant createdAt;

    /** Phase refreshed against {@code now}; never moves backwards. */
    public Auction refreshPhase(Instant now) {
        AuctionPhase refreshed = phase.advanceTo(AuctionPhase.at(now, startTime, endTime));
        return refreshed == phase ? this : toBuilder().phase(refreshed).build();
    }

    public boolean isClosed() {
        return phase == AuctionPhase.CLOSED;
    }
}
