package com.loanauction.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum AuctionType {
    /** Ascending auction, current leader visible to every bidder. */
    ENGLISH,
    /** Amounts hidden from other bidders until the auction closes. */
    SEALED_BID;

    /**
     * Accepts {@code ENGLISH}, {@code english}, {@code sealed_bid} and
     * {@code sealed-bid}.
     */
    @JsonCreator
    public static AuctionType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (AuctionType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown auction type: " + value);
    }
}
