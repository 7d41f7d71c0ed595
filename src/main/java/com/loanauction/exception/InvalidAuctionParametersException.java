package com.loanauction.exception;

import java.util.List;

public class InvalidAuctionParametersException extends AuctionException {

    private final List<String> violations;

    public InvalidAuctionParametersException(List<String> violations) {
        super("Invalid auction parameters: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
