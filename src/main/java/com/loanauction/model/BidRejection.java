package com.loanauction.model;

import java.math.BigDecimal;

/**
 * Why a bid was not accepted. {@code threshold} is the amount the bid had to
 * reach, or {@code null} when the rejection is not about the amount.
 */
public record BidRejection(BidRejectionReason reason, String message, BigDecimal threshold) {
}
