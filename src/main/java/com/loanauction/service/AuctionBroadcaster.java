package com.loanauction.service;

import com.loanauction.model.AuctionState;
import com.loanauction.model.AuctionType;
import com.loanauction.model.Bid;
import com.loanauction.model.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Pushes live auction updates to {@code /topic/auction/{auctionId}}.
 * Sealed-bid updates carry the bid count only.
 */
@Component
public class AuctionBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(AuctionBroadcaster.class);

    private final SimpMessagingTemplate messagingTemplate;

    public AuctionBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void bidPlaced(AuctionState state, Bid bid) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "BID_PLACED");
        payload.put("auctionId", state.getAuctionId().toString());
        payload.put("bidCount", state.getBids().size());
        if (state.getAuction().getAuctionType() == AuctionType.ENGLISH) {
            payload.put("bidderName", bid.getBidderName());
            payload.put("amount", bid.getAmount().toPlainString());
            payload.put("minimumNextBid",
                    bid.getAmount().add(state.getAuction().getBidIncrement()).toPlainString());
        }
        send(state.getAuctionId(), payload);
    }

    public void auctionClosed(Resolution resolution) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "AUCTION_CLOSED");
        payload.put("auctionId", resolution.auctionId().toString());
        payload.put("outcome", resolution.outcome().name());
        payload.put("totalBids", resolution.totalBids());
        if (resolution.hasWinner()) {
            payload.put("winningBidder", resolution.winningBidderName());
            payload.put("winningAmount", resolution.winningAmount().toPlainString());
        }
        send(resolution.auctionId(), payload);
    }

    private void send(UUID auctionId, Map<String, Object> payload) {
        try {
            messagingTemplate.convertAndSend("/topic/auction/" + auctionId, payload);
        } catch (MessagingException e) {
            log.warn("Broadcast {} for auction {} failed", payload.get("type"), auctionId, e);
        }
    }
}
