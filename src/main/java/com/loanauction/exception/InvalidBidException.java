package com.loanauction.exception;

/**
 * Malformed bid request, such as a missing bidder id. A well-formed bid that
 * breaks an auction rule is a rejection, not this exception.
 */
public class InvalidBidException extends AuctionException {

    public InvalidBidException(String message) {
        super(message);
    }
}
