package com.loanauction.model;

public enum ResolutionOutcome {
    WINNER,
    RESERVE_NOT_MET,
    NO_BIDS
}
