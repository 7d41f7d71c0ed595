package com.loanauction.service;

import com.loanauction.model.Auction;
import com.loanauction.model.AuctionState;
import com.loanauction.model.Bid;
import com.loanauction.model.Resolution;
import com.loanauction.model.RevealedBid;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Picks the winner of an auction being closed.
 *
 * <p>Both auction types select the highest amount, ties going to the earliest
 * accepted bid. A winning amount below the reserve price yields
 * {@code RESERVE_NOT_MET}; no bids yields {@code NO_BIDS}. Sealed-bid
 * resolutions disclose every bid.</p>
 */
@Component
public class ClosingResolver {

    public Resolution resolve(AuctionState state, Instant closedAt) {
        Auction auction = state.getAuction();
        List<Bid> bids = state.getBids();
        if (bids.isEmpty()) {
            return Resolution.noBids(auction.getId(), closedAt);
        }

        List<RevealedBid> revealed = switch (auction.getAuctionType()) {
            case ENGLISH -> List.of();
            case SEALED_BID -> bids.stream().map(RevealedBid::from).toList();
        };

        Bid top = bids.stream().min(Bid.BY_RANK).orElseThrow();
        if (top.getAmount().compareTo(auction.getReservePrice()) < 0) {
            return Resolution.reserveNotMet(auction.getId(), bids.size(), revealed, closedAt);
        }
        return Resolution.winner(auction.getId(), top, bids.size(), revealed, closedAt);
    }
}
