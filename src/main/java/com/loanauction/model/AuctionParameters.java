package com.loanauction.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Inbound auction parameters supplied by the API layer. Optional fields are
 * {@code null} when the caller leaves them out; defaults are applied at
 * creation.
 */
@Value
@Builder
public class AuctionParameters {

    String loanReference;
    String loanName;
    AuctionType auctionType;
    BigDecimal lotSize;
    BigDecimal minBid;
    BigDecimal bidIncrement;
    BigDecimal reservePrice;
    Instant startTime;
    Instant endTime;
    Integer durationHours;
    String createdBy;
}
