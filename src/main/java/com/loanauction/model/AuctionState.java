package com.loanauction.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything the engine knows about one auction at one point in time: the
 * auction, its accepted bids in acceptance order, and the resolution once
 * closed.
 *
 * <p>Instances are immutable. Every change produces a new instance which the
 * registry publishes in a single reference replace, so readers never observe
 * a half-applied bid or close.</p>
 *
 * <p>The constructor rejects any combination where the auction's winning bid
 * id, the bids' winning flags and the resolution disagree.</p>
 */
public final class AuctionState {

    private final Auction auction;
    private final List<Bid> bids;
    private final Resolution resolution;

    public AuctionState(Auction auction, List<Bid> bids, Resolution resolution) {
        this.auction = Objects.requireNonNull(auction, "auction");
        this.bids = List.copyOf(bids);
        this.resolution = resolution;
        checkConsistency();
    }

    public static AuctionState open(Auction auction) {
        return new AuctionState(auction, List.of(), null);
    }

    public Auction getAuction() {
        return auction;
    }

    public UUID getAuctionId() {
        return auction.getId();
    }

    public List<Bid> getBids() {
        return bids;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public boolean isResolved() {
        return resolution != null;
    }

    public Optional<BigDecimal> highestAmount() {
        return bids.stream().map(Bid::getAmount).max(BigDecimal::compareTo);
    }

    public List<Bid> bidsOf(String bidderId) {
        if (bidderId == null) {
            return List.of();
        }
        return bids.stream().filter(b -> bidderId.equals(b.getBidderId())).toList();
    }

    public AuctionState refreshed(Instant now) {
        Auction refreshed = auction.refreshPhase(now);
        return refreshed == auction ? this : new AuctionState(refreshed, bids, resolution);
    }

    public AuctionState withBid(Bid bid) {
        if (auction.isClosed()) {
            throw new IllegalStateException("Auction " + auction.getId() + " is closed");
        }
        List<Bid> next = new ArrayList<>(bids.size() + 1);
        next.addAll(bids);
        next.add(bid);
        return new AuctionState(auction, next, resolution);
    }

    /**
     * Closes the auction with {@code resolution}: phase, winning bid id and the
     * winning flag change together in the returned instance.
     */
    public AuctionState close(Resolution resolution) {
        if (isResolved()) {
            throw new IllegalStateException("Auction " + auction.getId() + " is already resolved");
        }
        UUID winnerId = resolution.winningBidId();
        List<Bid> settled = winnerId == null
                ? bids
                : bids.stream().map(b -> b.getId().equals(winnerId) ? b.markWinning() : b).toList();
        Auction closed = auction.toBuilder()
                .phase(AuctionPhase.CLOSED)
                .winningBidId(winnerId)
                .build();
        return new AuctionState(closed, settled, resolution);
    }

    private void checkConsistency() {
        List<Bid> winning = bids.stream().filter(Bid::isWinning).toList();
        if (winning.size() > 1) {
            throw new IllegalStateException("More than one winning bid on auction " + auction.getId());
        }
        if (resolution != null && !auction.isClosed()) {
            throw new IllegalStateException("Resolution on unclosed auction " + auction.getId());
        }
        UUID winningBidId = auction.getWinningBidId();
        if (winningBidId == null) {
            if (!winning.isEmpty() || (resolution != null && resolution.hasWinner())) {
                throw new IllegalStateException("Winning bid without winning bid id on auction " + auction.getId());
            }
            return;
        }
        boolean consistent = resolution != null
                && resolution.hasWinner()
                && winningBidId.equals(resolution.winningBidId())
                && winning.size() == 1
                && winningBidId.equals(winning.get(0).getId());
        if (!consistent) {
            throw new IllegalStateException("Winning bid id " + winningBidId
                    + " does not match a winning bid on auction " + auction.getId());
        }
    }
}
