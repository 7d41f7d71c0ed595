package com.loanauction.exception;

/**
 * Base type for errors raised by the auction engine. Bid rejections are not
 * exceptions; they come back as {@link com.loanauction.dto.BidOutcome}.
 */
public abstract class AuctionException extends RuntimeException {

    protected AuctionException(String message) {
        super(message);
    }

    protected AuctionException(String message, Throwable cause) {
        super(message, cause);
    }
}
