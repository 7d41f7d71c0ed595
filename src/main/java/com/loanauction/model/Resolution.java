package com.loanauction.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of closing an auction. Computed once and stored; later close calls
 * return the same instance.
 *
 * <p>{@code revealedBids} is populated for sealed-bid auctions only.</p>
 */
public record Resolution(UUID auctionId,
                         ResolutionOutcome outcome,
                         UUID winningBidId,
                         String winningBidderId,
                         String winningBidderName,
                         BigDecimal winningAmount,
                         int totalBids,
                         List<RevealedBid> revealedBids,
                         Instant closedAt) {

    public Resolution {
        revealedBids = revealedBids == null ? List.of() : List.copyOf(revealedBids);
    }

    public static Resolution winner(UUID auctionId, Bid bid, int totalBids,
                                    List<RevealedBid> revealedBids, Instant closedAt) {
        return new Resolution(auctionId, ResolutionOutcome.WINNER, bid.getId(), bid.getBidderId(),
                bid.getBidderName(), bid.getAmount(), totalBids, revealedBids, closedAt);
    }

    public static Resolution reserveNotMet(UUID auctionId, int totalBids,
                                           List<RevealedBid> revealedBids, Instant closedAt) {
        return new Resolution(auctionId, ResolutionOutcome.RESERVE_NOT_MET, null, null, null, null,
                totalBids, revealedBids, closedAt);
    }

    public static Resolution noBids(UUID auctionId, Instant closedAt) {
        return new Resolution(auctionId, ResolutionOutcome.NO_BIDS, null, null, null, null,
                0, List.of(), closedAt);
    }

    public boolean hasWinner() {
        return outcome == ResolutionOutcome.WINNER;
    }
}
