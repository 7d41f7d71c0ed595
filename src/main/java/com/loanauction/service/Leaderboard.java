package com.loanauction.service;

import com.loanauction.config.AuctionProperties;
import com.loanauction.dto.LeaderEntry;
import com.loanauction.model.Auction;
import com.loanauction.model.AuctionState;
import com.loanauction.model.Bid;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ranked view of an auction's bids, recomputed from the snapshot on every call.
 * Sealed-bid auctions have an empty leaderboard until they close.
 */
@Component
public class Leaderboard {

    private final int size;

    public Leaderboard(AuctionProperties properties) {
        this.size = properties.getLeaderboardSize();
    }

    public List<LeaderEntry> rank(AuctionState state) {
        if (!isVisible(state.getAuction())) {
            return List.of();
        }
        AtomicInteger rank = new AtomicInteger();
        return state.getBids().stream()
                .sorted(Bid.BY_RANK)
                .limit(size)
                .map(b -> new LeaderEntry(rank.incrementAndGet(), b.getBidderId(), b.getBidderName(),
                        b.getAmount(), b.getSubmittedAt()))
                .toList();
    }

    public Optional<LeaderEntry> currentLeader(AuctionState state) {
        return rank(state).stream().findFirst();
    }

    private boolean isVisible(Auction auction) {
        return switch (auction.getAuctionType()) {
            case ENGLISH -> true;
            case SEALED_BID -> auction.isClosed();
        };
    }
}
