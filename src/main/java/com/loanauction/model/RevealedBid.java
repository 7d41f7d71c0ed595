package com.loanauction.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Bid disclosed in a sealed-bid resolution.
 */
public record RevealedBid(UUID bidId, String bidderId, String bidderName, BigDecimal amount, Instant submittedAt) {

    public static RevealedBid from(Bid bid) {
        return new RevealedBid(bid.getId(), bid.getBidderId(), bid.getBidderName(),
                bid.getAmount(), bid.getSubmittedAt());
    }
}
