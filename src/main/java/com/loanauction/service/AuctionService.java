package com.loanauction.service;

import com.loanauction.audit.AuditPublisher;
import com.loanauction.audit.AuditRecord;
import com.loanauction.config.AuctionProperties;
import com.loanauction.dto.AuctionView;
import com.loanauction.dto.BidOutcome;
import com.loanauction.dto.BidView;
import com.loanauction.dto.CloseResult;
import com.loanauction.dto.LeaderEntry;
import com.loanauction.exception.InvalidAuctionParametersException;
import com.loanauction.exception.InvalidBidException;
import com.loanauction.model.Auction;
import com.loanauction.model.AuctionParameters;
import com.loanauction.model.AuctionPhase;
import com.loanauction.model.AuctionState;
import com.loanauction.model.AuctionType;
import com.loanauction.model.Bid;
import com.loanauction.model.BidRejection;
import com.loanauction.model.Resolution;
import com.loanauction.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Entry point of the auction engine: creates auctions, places bids, closes
 * auctions and serves read views.
 *
 * <p>Bid placement and close run under the auction's lock: the current state
 * is read, checked and replaced as one step, so two bids that both saw the
 * same highest amount cannot both be accepted. Reads take the current state
 * without locking.</p>
 *
 * <p>Audit records and live updates go out after the new state is published;
 * their failures do not affect the result.</p>
 */
@Service
public class AuctionService {

    private static final Logger log = LoggerFactory.getLogger(AuctionService.class);
    private static final String DEFAULT_LOAN_NAME = "Unnamed Loan";

    private final AuctionRegistry registry;
    private final AuctionLockManager lockManager;
    private final BidValidator bidValidator;
    private final ClosingResolver closingResolver;
    private final Leaderboard leaderboard;
    private final TimeSource timeSource;
    private final AuctionProperties properties;
    private final AuditPublisher auditPublisher;
    private final AuctionBroadcaster broadcaster;

    public AuctionService(AuctionRegistry registry,
                          AuctionLockManager lockManager,
                          BidValidator bidValidator,
                          ClosingResolver closingResolver,
                          Leaderboard leaderboard,
                          TimeSource timeSource,
                          AuctionProperties properties,
                          AuditPublisher auditPublisher,
                          AuctionBroadcaster broadcaster) {
        this.registry = registry;
        this.lockManager = lockManager;
        this.bidValidator = bidValidator;
        this.closingResolver = closingResolver;
        this.leaderboard = leaderboard;
        this.timeSource = timeSource;
        this.properties = properties;
        this.auditPublisher = auditPublisher;
        this.broadcaster = broadcaster;
    }

    /**
     * Create a new auction. Phase is PENDING when the start time is still
     * ahead, ACTIVE otherwise.
     */
    public AuctionView createAuction(AuctionParameters params) {
        Instant now = timeSource.now();
        Auction auction = buildAuction(params, now);
        AuctionState state = AuctionState.open(auction);
        registry.register(state);

        log.info("Auction created: id={}, loan={}, type={}, phase={}, start={}, end={}",
                auction.getId(), auction.getLoanReference(), auction.getAuctionType(),
                auction.getPhase(), auction.getStartTime(), auction.getEndTime());
        auditPublisher.publish(new AuditRecord("auction.created", "auction", auction.getId().toString(),
                auction.getCreatedBy(), "create",
                AuditRecord.details(
                        "loanReference", auction.getLoanReference(),
                        "auctionType", auction.getAuctionType().name(),
                        "minBid", auction.getMinBid(),
                        "bidIncrement", auction.getBidIncrement(),
                        "reservePrice", auction.getReservePrice(),
                        "startTime", auction.getStartTime().toString(),
                        "endTime", auction.getEndTime().toString()),
                now));
        return toView(state, null);
    }

    /**
     * Place a bid. Rule violations come back as a rejected outcome, not as an
     * exception.
     *
     * @throws com.loanauction.exception.AuctionNotFoundException unknown auction
     * @throws com.loanauction.exception.AuctionLockTimeoutException auction busy; retry
     */
    public BidOutcome placeBid(UUID auctionId, String bidderId, String bidderName, BigDecimal amount) {
        if (bidderId == null || bidderId.isBlank()) {
            throw new InvalidBidException("bidderId is required");
        }
        registry.get(auctionId);

        Placement placement = lockManager.withAuctionLock(auctionId, () -> {
            Instant now = timeSource.now();
            AuctionState current = registry.snapshot(auctionId, now);
            BidValidator.ValidationResult result = bidValidator.validate(current, amount, now);
            if (!result.isValid()) {
                registry.publish(current);
                return new Placement(current, null, result.getRejection(), now);
            }
            Bid bid = Bid.builder()
                    .id(UUID.randomUUID())
                    .auctionId(auctionId)
                    .bidderId(bidderId)
                    .bidderName(bidderName != null ? bidderName : bidderId)
                    .amount(amount)
                    .submittedAt(now)
                    .sequence(current.getBids().size() + 1L)
                    .build();
            AuctionState next = current.withBid(bid);
            registry.publish(next);
            return new Placement(next, bid, null, now);
        });

        if (placement.bid() == null) {
            BidRejection rejection = placement.rejection();
            log.info("Bid rejected: auction={}, bidder={}, amount={}, reason={}",
                    auctionId, bidderId, amount, rejection.reason());
            auditPublisher.publish(new AuditRecord("bid.rejected", "auction", auctionId.toString(),
                    bidderId, "reject",
                    AuditRecord.details(
                            "reason", rejection.reason().name(),
                            "message", rejection.message(),
                            "amount", amount,
                            "threshold", rejection.threshold()),
                    placement.at()));
            return BidOutcome.rejected(rejection);
        }

        Bid bid = placement.bid();
        log.debug("Bid placed: auction={}, bidder={}, amount={}, sequence={}",
                auctionId, bidderId, amount, bid.getSequence());
        auditPublisher.publish(new AuditRecord("bid.accepted", "bid", bid.getId().toString(),
                bidderId, "place",
                AuditRecord.details(
                        "auctionId", auctionId.toString(),
                        "amount", amount,
                        "sequence", bid.getSequence()),
                placement.at()));
        broadcaster.bidPlaced(placement.state(), bid);
        return BidOutcome.accepted(BidView.from(bid));
    }

    /**
     * Close an auction and fix its winner. Closing a resolved auction returns
     * the stored resolution with {@code alreadyClosed} set.
     */
    public CloseResult closeAuction(UUID auctionId, String closedBy) {
        registry.get(auctionId);

        CloseResult result = lockManager.withAuctionLock(auctionId, () -> {
            Instant now = timeSource.now();
            AuctionState current = registry.snapshot(auctionId, now);
            if (current.isResolved()) {
                return new CloseResult(current.getResolution(), true);
            }
            Resolution resolution = closingResolver.resolve(current, now);
            registry.publish(current.close(resolution));
            return new CloseResult(resolution, false);
        });

        if (result.alreadyClosed()) {
            log.debug("Auction {} already closed, returning stored resolution", auctionId);
            return result;
        }

        Resolution resolution = result.resolution();
        log.info("Auction {} closed: outcome={}, winner={}, amount={}, bids={}",
                auctionId, resolution.outcome(), resolution.winningBidderId(),
                resolution.winningAmount(), resolution.totalBids());
        auditPublisher.publish(new AuditRecord("auction.closed", "auction", auctionId.toString(),
                closedBy, "close",
                AuditRecord.details(
                        "outcome", resolution.outcome().name(),
                        "winningBidId", resolution.winningBidId() != null ? resolution.winningBidId().toString() : null,
                        "winningAmount", resolution.winningAmount(),
                        "totalBids", resolution.totalBids()),
                resolution.closedAt()));
        broadcaster.auctionClosed(resolution);
        return result;
    }

    public AuctionView getAuction(UUID auctionId, String viewerId) {
        return toView(registry.snapshot(auctionId, timeSource.now()), viewerId);
    }

    public List<LeaderEntry> getLeaderboard(UUID auctionId) {
        return leaderboard.rank(registry.snapshot(auctionId, timeSource.now()));
    }

    /**
     * Bids in acceptance order. Before a sealed-bid auction closes only the
     * viewer's own bids are returned.
     */
    public List<BidView> listBids(UUID auctionId, String viewerId) {
        AuctionState state = registry.snapshot(auctionId, timeSource.now());
        List<Bid> visible = isSealedAndOpen(state.getAuction()) ? state.bidsOf(viewerId) : state.getBids();
        return visible.stream().map(BidView::from).toList();
    }

    /** Auctions created for one loan, newest first. */
    public List<AuctionView> listAuctionsForLoan(String loanReference) {
        Instant now = timeSource.now();
        return registry.findByLoanReference(loanReference).stream()
                .map(s -> s.refreshed(now))
                .sorted(Comparator.comparing((AuctionState s) -> s.getAuction().getCreatedAt()).reversed())
                .map(s -> toView(s, null))
                .toList();
    }

    private Auction buildAuction(AuctionParameters params, Instant now) {
        List<String> errors = new ArrayList<>();

        if (params.getLoanReference() == null || params.getLoanReference().isBlank()) {
            errors.add("loanReference is required");
        }
        if (params.getCreatedBy() == null || params.getCreatedBy().isBlank()) {
            errors.add("createdBy is required");
        }

        BigDecimal lotSize = orZero(params.getLotSize());
        BigDecimal minBid = orZero(params.getMinBid());
        BigDecimal reservePrice = orZero(params.getReservePrice());
        BigDecimal bidIncrement = params.getBidIncrement() != null
                ? params.getBidIncrement() : properties.getDefaultBidIncrement();

        if (lotSize.signum() < 0) {
            errors.add("lotSize must not be negative");
        }
        if (minBid.signum() < 0) {
            errors.add("minBid must not be negative");
        }
        if (reservePrice.signum() < 0) {
            errors.add("reservePrice must not be negative");
        }
        if (bidIncrement.signum() <= 0) {
            errors.add("bidIncrement must be greater than zero");
        }

        Instant startTime = params.getStartTime() != null ? params.getStartTime() : now;
        Instant endTime = params.getEndTime();
        if (endTime == null) {
            int hours = params.getDurationHours() != null
                    ? params.getDurationHours() : properties.getDefaultDurationHours();
            if (hours <= 0) {
                errors.add("durationHours must be greater than zero");
            }
            endTime = startTime.plus(Duration.ofHours(hours));
        }
        if (!endTime.isAfter(startTime)) {
            errors.add("endTime must be after startTime");
        }

        if (!errors.isEmpty()) {
            log.warn("Auction creation rejected for loan {}: {}", params.getLoanReference(), errors);
            throw new InvalidAuctionParametersException(errors);
        }

        return Auction.builder()
                .id(UUID.randomUUID())
                .loanReference(params.getLoanReference())
                .loanName(params.getLoanName() != null ? params.getLoanName() : DEFAULT_LOAN_NAME)
                .auctionType(params.getAuctionType() != null ? params.getAuctionType() : AuctionType.ENGLISH)
                .lotSize(lotSize)
                .minBid(minBid)
                .bidIncrement(bidIncrement)
                .reservePrice(reservePrice)
                .startTime(startTime)
                .endTime(endTime)
                .phase(now.isBefore(startTime) ? AuctionPhase.PENDING : AuctionPhase.ACTIVE)
                .createdBy(params.getCreatedBy())
                .createdAt(now)
                .build();
    }

    private AuctionView toView(AuctionState state, String viewerId) {
        Auction auction = state.getAuction();
        boolean englishActive = auction.getAuctionType() == AuctionType.ENGLISH
                && auction.getPhase() == AuctionPhase.ACTIVE;

        LeaderEntry currentLeader = englishActive ? leaderboard.currentLeader(state).orElse(null) : null;
        BigDecimal minimumNextBid = englishActive
                ? state.highestAmount().map(h -> h.add(auction.getBidIncrement())).orElse(auction.getMinBid())
                : null;
        List<BidView> ownBids = viewerId != null
                ? state.bidsOf(viewerId).stream().map(BidView::from).toList()
                : null;

        return new AuctionView(
                auction.getId(),
                auction.getLoanReference(),
                auction.getLoanName(),
                auction.getAuctionType(),
                auction.getLotSize(),
                auction.getMinBid(),
                auction.getBidIncrement(),
                auction.getReservePrice(),
                auction.getStartTime(),
                auction.getEndTime(),
                auction.getPhase(),
                auction.getCreatedBy(),
                auction.getCreatedAt(),
                state.getBids().size(),
                currentLeader,
                minimumNextBid,
                state.getResolution(),
                ownBids);
    }

    private static boolean isSealedAndOpen(Auction auction) {
        return auction.getAuctionType() == AuctionType.SEALED_BID && !auction.isClosed();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private record Placement(AuctionState state, Bid bid, BidRejection rejection, Instant at) {
    }
}
