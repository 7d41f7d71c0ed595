package com.loanauction.controller;

import com.loanauction.dto.AuctionView;
import com.loanauction.dto.BidOutcome;
import com.loanauction.dto.BidView;
import com.loanauction.dto.CloseResult;
import com.loanauction.dto.CreateAuctionRequest;
import com.loanauction.dto.LeaderEntry;
import com.loanauction.dto.PlaceBidRequest;
import com.loanauction.model.BidRejection;
import com.loanauction.service.AuctionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for auctions and bids.
 */
@RestController
@RequestMapping("/api/v1")
public class AuctionController {

    private final AuctionService auctionService;

    public AuctionController(AuctionService auctionService) {
        this.auctionService = auctionService;
    }

    @PostMapping("/auctions")
    public ResponseEntity<AuctionView> createAuction(@RequestBody CreateAuctionRequest request) {
        AuctionView created = auctionService.createAuction(request.toParameters());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/auctions/{auctionId}")
    public AuctionView getAuction(@PathVariable UUID auctionId,
                                  @RequestParam(required = false) String viewerId) {
        return auctionService.getAuction(auctionId, viewerId);
    }

    @PostMapping("/auctions/{auctionId}/bids")
    public ResponseEntity<?> placeBid(@PathVariable UUID auctionId, @RequestBody PlaceBidRequest request) {
        BidOutcome outcome = auctionService.placeBid(
                auctionId, request.getBidderId(), request.getBidderName(), request.getAmount());
        if (outcome.isAccepted()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(outcome.getBid());
        }
        BidRejection rejection = outcome.getRejection();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("error", "Bid Rejected");
        body.put("reason", rejection.reason().name());
        body.put("message", rejection.message());
        if (rejection.threshold() != null) {
            body.put("threshold", rejection.threshold());
        }
        return ResponseEntity.badRequest().body(body);
    }

    @GetMapping("/auctions/{auctionId}/bids")
    public List<BidView> listBids(@PathVariable UUID auctionId,
                                  @RequestParam(required = false) String viewerId) {
        return auctionService.listBids(auctionId, viewerId);
    }

    @GetMapping("/auctions/{auctionId}/leaderboard")
    public Map<String, Object> getLeaderboard(@PathVariable UUID auctionId) {
        List<LeaderEntry> entries = auctionService.getLeaderboard(auctionId);
        return Map.of("auctionId", auctionId, "leaderboard", entries);
    }

    @PostMapping("/auctions/{auctionId}/close")
    public CloseResult closeAuction(@PathVariable UUID auctionId,
                                    @RequestHeader(value = "X-User-Id", required = false) String userId) {
        return auctionService.closeAuction(auctionId, userId);
    }

    @GetMapping("/loans/{loanReference}/auctions")
    public List<AuctionView> listAuctionsForLoan(@PathVariable String loanReference) {
        return auctionService.listAuctionsForLoan(loanReference);
    }
}
