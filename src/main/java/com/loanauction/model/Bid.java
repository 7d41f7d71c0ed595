package com.loanauction.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.UUID;

/**
 * An accepted bid. Rejected bids never become a {@code Bid} and never get an id.
 */
@Value
@Builder(toBuilder = true)
public class Bid {

    /** Highest amount first, then earliest acceptance. */
    public static final Comparator<Bid> BY_RANK = Comparator
            .comparing(Bid::getAmount, Comparator.reverseOrder())
            .thenComparing(Bid::getSubmittedAt)
            .thenComparingLong(Bid::getSequence);

    UUID id;
    UUID auctionId;
    String bidderId;
    String bidderName;
    BigDecimal amount;
    Instant submittedAt;
    // 1-based acceptance ordinal within the auction
    long sequence;
    boolean winning;

    public Bid markWinning() {
        return toBuilder().winning(true).build();
    }
}
