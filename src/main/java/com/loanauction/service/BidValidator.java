package com.loanauction.service;

import com.loanauction.model.Auction;
import com.loanauction.model.AuctionPhase;
import com.loanauction.model.AuctionState;
import com.loanauction.model.BidRejection;
import com.loanauction.model.BidRejectionReason;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Checks a candidate bid amount against an auction snapshot.
 *
 * <p>Rules run in a fixed order and the first failure decides the reason:
 * closed, past end time, not yet started, non-positive amount, below the
 * minimum bid, below the current highest plus increment.</p>
 *
 * <p>No side effects; the caller holds the auction lock so the snapshot cannot
 * change between validation and acceptance.</p>
 */
@Component
public class BidValidator {

    public static final class ValidationResult {
        private static final ValidationResult VALID = new ValidationResult(null);

        private final BidRejection rejection;

        private ValidationResult(BidRejection rejection) {
            this.rejection = rejection;
        }

        public static ValidationResult valid() {
            return VALID;
        }

        public static ValidationResult rejected(BidRejectionReason reason, String message, BigDecimal threshold) {
            return new ValidationResult(new BidRejection(reason, message, threshold));
        }

        public boolean isValid() {
            return rejection == null;
        }

        public BidRejection getRejection() {
            return rejection;
        }
    }

    public ValidationResult validate(AuctionState state, BigDecimal amount, Instant now) {
        Auction auction = state.getAuction();

        if (auction.getPhase() == AuctionPhase.CLOSED) {
            return ValidationResult.rejected(BidRejectionReason.AUCTION_CLOSED, "Auction is closed", null);
        }
        if (now.isAfter(auction.getEndTime())) {
            return ValidationResult.rejected(BidRejectionReason.AUCTION_CLOSED, "Auction has ended", null);
        }
        if (now.isBefore(auction.getStartTime())) {
            return ValidationResult.rejected(BidRejectionReason.AUCTION_NOT_STARTED,
                    "Auction has not started yet; bidding opens at " + auction.getStartTime(), null);
        }
        if (amount == null || amount.signum() <= 0) {
            return ValidationResult.rejected(BidRejectionReason.INVALID_AMOUNT,
                    "Bid amount must be greater than zero", BigDecimal.ZERO);
        }
        if (amount.compareTo(auction.getMinBid()) < 0) {
            return ValidationResult.rejected(BidRejectionReason.BELOW_MINIMUM,
                    "Bid must be at least $" + auction.getMinBid().toPlainString(), auction.getMinBid());
        }

        Optional<BigDecimal> highest = state.highestAmount();
        if (highest.isPresent()) {
            BigDecimal required = highest.get().add(auction.getBidIncrement());
            if (amount.compareTo(required) < 0) {
                return ValidationResult.rejected(BidRejectionReason.BELOW_INCREMENT,
                        incrementMessage(auction, highest.get(), required), required);
            }
        }
        return ValidationResult.valid();
    }

    private String incrementMessage(Auction auction, BigDecimal highest, BigDecimal required) {
        return switch (auction.getAuctionType()) {
            case ENGLISH -> String.format("Bid must be at least $%s (current highest: $%s + increment: $%s)",
                    required.toPlainString(), highest.toPlainString(), auction.getBidIncrement().toPlainString());
            // sealed bidders never learn the current highest amount
            case SEALED_BID -> "Bid must be at least $" + required.toPlainString();
        };
    }
}
