package com.loanauction.service;

import com.loanauction.exception.AuctionNotFoundException;
import com.loanauction.model.AuctionState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative store of every auction's state.
 *
 * <p>Each auction maps to one immutable {@link AuctionState}. Writers replace
 * the whole value, and only from inside the auction's lock scope (see
 * {@link AuctionLockManager}); readers take whatever value is current without
 * locking.</p>
 *
 * <p>Reads refresh the phase against the supplied instant without storing it.
 * The refreshed phase is stored by the next write.</p>
 */
@Component
public class AuctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(AuctionRegistry.class);

    private final ConcurrentHashMap<UUID, AuctionState> states = new ConcurrentHashMap<>();

    public void register(AuctionState state) {
        AuctionState previous = states.putIfAbsent(state.getAuctionId(), state);
        if (previous != null) {
            throw new IllegalStateException("Auction already registered: " + state.getAuctionId());
        }
    }

    /**
     * @throws AuctionNotFoundException when no auction has this id
     */
    public AuctionState get(UUID auctionId) {
        AuctionState state = states.get(auctionId);
        if (state == null) {
            throw new AuctionNotFoundException(auctionId);
        }
        return state;
    }

    /** Current state with its phase refreshed against {@code now}. */
    public AuctionState snapshot(UUID auctionId, Instant now) {
        return get(auctionId).refreshed(now);
    }

    /**
     * Replaces the stored state. Callers must hold the auction's lock.
     */
    public void publish(AuctionState next) {
        UUID auctionId = next.getAuctionId();
        AuctionState current = get(auctionId);
        if (current == next) {
            return;
        }
        if (next.getAuction().getPhase().isBefore(current.getAuction().getPhase())) {
            throw new IllegalStateException("Phase of auction " + auctionId + " cannot move from "
                    + current.getAuction().getPhase() + " to " + next.getAuction().getPhase());
        }
        states.put(auctionId, next);
    }

    public List<AuctionState> findByLoanReference(String loanReference) {
        return states.values().stream()
                .filter(s -> s.getAuction().getLoanReference().equals(loanReference))
                .toList();
    }

    public int size() {
        return states.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Auction registry shutting down with {} auctions", states.size());
        states.clear();
    }
}
