package com.loanauction.exception;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidAuctionParametersException.class)
    public ResponseEntity<?> handleInvalidParameters(InvalidAuctionParametersException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "timestamp", LocalDateTime.now(),
                        "error", "Invalid Parameters",
                        "message", ex.getMessage(),
                        "violations", ex.getViolations()
                ));
    }

    @ExceptionHandler(InvalidBidException.class)
    public ResponseEntity<?> handleInvalidBid(InvalidBidException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "timestamp", LocalDateTime.now(),
                        "error", "Invalid Bid",
                        "message", ex.getMessage()
                ));
    }

    @ExceptionHandler(AuctionNotFoundException.class)
    public ResponseEntity<?> handleNotFound(AuctionNotFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(Map.of(
                        "timestamp", LocalDateTime.now(),
                        "error", "Not Found",
                        "message", ex.getMessage()
                ));
    }

    @ExceptionHandler(AuctionLockTimeoutException.class)
    public ResponseEntity<?> handleLockTimeout(AuctionLockTimeoutException ex) {
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "1")
                .body(Map.of(
                        "timestamp", LocalDateTime.now(),
                        "error", "Lock Timeout",
                        "message", ex.getMessage()
                ));
    }
}
