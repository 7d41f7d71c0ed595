package com.loanauction.dto;

import com.loanauction.model.BidRejection;

/**
 * Result of placing a bid: either the accepted bid or the rejection.
 */
public final class BidOutcome {

    private final BidView bid;
    private final BidRejection rejection;

    private BidOutcome(BidView bid, BidRejection rejection) {
        this.bid = bid;
        this.rejection = rejection;
    }

    public static BidOutcome accepted(BidView bid) {
        return new BidOutcome(bid, null);
    }

    public static BidOutcome rejected(BidRejection rejection) {
        return new BidOutcome(null, rejection);
    }

    public boolean isAccepted() {
        return bid != null;
    }

    /** @return the accepted bid, {@code null} when rejected */
    public BidView getBid() {
        return bid;
    }

    /** @return the rejection, {@code null} when accepted */
    public BidRejection getRejection() {
        return rejection;
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted(" + bid.id() + ")" : "Rejected(" + rejection.reason() + ")";
    }
}
