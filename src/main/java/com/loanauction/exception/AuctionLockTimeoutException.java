package com.loanauction.exception;

import java.time.Duration;
import java.util.UUID;

/**
 * The per-auction lock could not be acquired in time. The request was never
 * considered and is safe to retry unchanged.
 */
public class AuctionLockTimeoutException extends AuctionException {

    private final UUID auctionId;

    public AuctionLockTimeoutException(UUID auctionId, Duration waited) {
        super(String.format("Auction %s is busy; lock not acquired within %d ms", auctionId, waited.toMillis()));
        this.auctionId = auctionId;
    }

    public AuctionLockTimeoutException(UUID auctionId, Duration waited, Throwable cause) {
        super(String.format("Interrupted while waiting %d ms for auction %s", waited.toMillis(), auctionId), cause);
        this.auctionId = auctionId;
    }

    public UUID getAuctionId() {
        return auctionId;
    }
}
