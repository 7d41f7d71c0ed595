package com.loanauction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.loanauction.model.AuctionPhase;
import com.loanauction.model.AuctionType;
import com.loanauction.model.Resolution;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Auction as seen by a caller.
 *
 * <p>{@code currentLeader} and {@code minimumNextBid} are present only for an
 * active English auction. {@code resolution} is present only once the auction
 * has been closed and resolved. {@code ownBids} holds the viewer's own bids,
 * the only amounts a sealed-bid participant sees before close.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuctionView(UUID id,
                          String loanReference,
                          String loanName,
                          AuctionType auctionType,
                          BigDecimal lotSize,
                          BigDecimal minBid,
                          BigDecimal bidIncrement,
                          BigDecimal reservePrice,
                          Instant startTime,
                          Instant endTime,
                          AuctionPhase phase,
                          String createdBy,
                          Instant createdAt,
                          int bidCount,
                          LeaderEntry currentLeader,
                          BigDecimal minimumNextBid,
                          Resolution resolution,
                          List<BidView> ownBids) {
}
