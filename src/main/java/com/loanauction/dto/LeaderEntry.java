package com.loanauction.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row of the leaderboard. {@code rank} starts at 1.
 */
public record LeaderEntry(int rank, String bidderId, String bidderName, BigDecimal amount, Instant submittedAt) {
}
