package com.loanauction.dto;

import com.loanauction.model.Bid;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record BidView(UUID id,
                      UUID auctionId,
                      String bidderId,
                      String bidderName,
                      BigDecimal amount,
                      Instant submittedAt,
                      boolean winning) {

    public static BidView from(Bid bid) {
        return new BidView(bid.getId(), bid.getAuctionId(), bid.getBidderId(), bid.getBidderName(),
                bid.getAmount(), bid.getSubmittedAt(), bid.isWinning());
    }
}
