package com.loanauction.model;

public enum BidRejectionReason {
    AUCTION_CLOSED,
    AUCTION_NOT_STARTED,
    INVALID_AMOUNT,
    BELOW_MINIMUM,
    BELOW_INCREMENT
}
