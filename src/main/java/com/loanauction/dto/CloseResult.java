package com.loanauction.dto;

import com.loanauction.model.Resolution;

/**
 * Result of a close call. {@code alreadyClosed} is true when the auction had
 * been resolved before and {@code resolution} is the stored one.
 */
public record CloseResult(Resolution resolution, boolean alreadyClosed) {
}
