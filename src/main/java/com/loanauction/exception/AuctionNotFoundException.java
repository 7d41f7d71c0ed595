package com.loanauction.exception;

import java.util.UUID;

public class AuctionNotFoundException extends AuctionException {

    private final UUID auctionId;

    public AuctionNotFoundException(UUID auctionId) {
        super("Auction not found: " + auctionId);
        this.auctionId = auctionId;
    }

    public UUID getAuctionId() {
        return auctionId;
    }
}
