package com.loanauction.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.loanauction.audit.AuditPublisher;
import com.loanauction.audit.AuditRecord;
import com.loanauction.audit.AuditSink;
import com.loanauction.config.AuctionProperties;
import com.loanauction.dto.AuctionView;
import com.loanauction.dto.BidOutcome;
import com.loanauction.dto.BidView;
import com.loanauction.dto.CloseResult;
import com.loanauction.dto.LeaderEntry;
import com.loanauction.exception.AuctionLockTimeoutException;
import com.loanauction.exception.AuctionNotFoundException;
import com.loanauction.exception.InvalidAuctionParametersException;
import com.loanauction.exception.InvalidBidException;
import com.loanauction.model.AuctionParameters;
import com.loanauction.model.AuctionPhase;
import com.loanauction.model.AuctionType;
import com.loanauction.model.BidRejectionReason;
import com.loanauction.model.Resolution;
import com.loanauction.model.ResolutionOutcome;
import com.loanauction.time.MutableTimeSource;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AuctionService.
 * Runs the real registry, lock manager, validator and resolver against a
 * controllable clock; audit and broadcast collaborators are mocked.
 */
class AuctionServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-04T10:00:00Z");

    private MutableTimeSource timeSource;
    private AuctionProperties properties;
    private AuctionRegistry registry;
    private AuctionLockManager lockManager;
    private AuditPublisher auditPublisher;
    private AuctionBroadcaster broadcaster;
    private AuctionService auctionService;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        timeSource = new MutableTimeSource(NOW);
        properties = new AuctionProperties();
        auditPublisher = mock(AuditPublisher.class);
        broadcaster = mock(AuctionBroadcaster.class);
        auctionService = newService(properties, auditPublisher);
        pool = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private AuctionService newService(AuctionProperties props, AuditPublisher publisher) {
        registry = new AuctionRegistry();
        lockManager = new AuctionLockManager(props);
        return new AuctionService(registry, lockManager, new BidValidator(), new ClosingResolver(),
                new Leaderboard(props), timeSource, props, publisher, broadcaster);
    }

    private AuctionParameters.AuctionParametersBuilder english() {
        return AuctionParameters.builder()
                .loanReference("analysis-42")
                .loanName("Acme Term Loan B")
                .auctionType(AuctionType.ENGLISH)
                .lotSize(new BigDecimal("5000000"))
                .minBid(new BigDecimal("1000"))
                .bidIncrement(new BigDecimal("50"))
                .reservePrice(new BigDecimal("1200"))
                .startTime(NOW.minusSeconds(60))
                .endTime(NOW.plus(Duration.ofHours(2)))
                .createdBy("seller-1");
    }

    private BidOutcome bid(UUID auctionId, String bidder, String amount) {
        return auctionService.placeBid(auctionId, bidder, bidder.toUpperCase(), new BigDecimal(amount));
    }

    /**
     * Min 1000, increment 50, reserve 1200: A bids 1000, B bids 1040, C bids 1500, then close.
     */
    @Test
    void testScenario_EnglishAuctionClosesWithHighestBidder() {
        UUID id = auctionService.createAuction(english().build()).id();

        BidOutcome a = bid(id, "alice", "1000");
        BidOutcome b = bid(id, "bob", "1040");
        BidOutcome c = bid(id, "carol", "1500");
        CloseResult result = auctionService.closeAuction(id, "seller-1");

        assertTrue(a.isAccepted());
        assertFalse(b.isAccepted());
        assertEquals(BidRejectionReason.BELOW_INCREMENT, b.getRejection().reason());
        assertEquals(0, new BigDecimal("1050").compareTo(b.getRejection().threshold()));
        assertTrue(c.isAccepted());

        Resolution resolution = result.resolution();
        assertFalse(result.alreadyClosed());
        assertEquals(ResolutionOutcome.WINNER, resolution.outcome());
        assertEquals(c.getBid().id(), resolution.winningBidId());
        assertEquals("carol", resolution.winningBidderId());
        assertEquals(0, new BigDecimal("1500").compareTo(resolution.winningAmount()));

        List<BidView> bids = auctionService.listBids(id, null);
        assertEquals(2, bids.size());
        assertFalse(bids.get(0).winning());
        assertTrue(bids.get(1).winning());
    }

    @Test
    void testCreateAuction_FutureStart_PendingThenActiveThenClosedByTime() {
        UUID id = auctionService.createAuction(english()
                .startTime(NOW.plus(Duration.ofHours(1)))
                .endTime(NOW.plus(Duration.ofHours(3)))
                .build()).id();

        assertEquals(AuctionPhase.PENDING, auctionService.getAuction(id, null).phase());
        assertEquals(BidRejectionReason.AUCTION_NOT_STARTED, bid(id, "alice", "1000").getRejection().reason());

        timeSource.advance(Duration.ofHours(1));
        assertEquals(AuctionPhase.ACTIVE, auctionService.getAuction(id, null).phase());
        assertTrue(bid(id, "alice", "1000").isAccepted());

        timeSource.advance(Duration.ofHours(2));
        AuctionView ended = auctionService.getAuction(id, null);
        assertEquals(AuctionPhase.CLOSED, ended.phase());
        assertNull(ended.resolution());
        assertNull(ended.currentLeader());
        assertEquals(BidRejectionReason.AUCTION_CLOSED, bid(id, "bob", "5000").getRejection().reason());

        CloseResult result = auctionService.closeAuction(id, "seller-1");
        assertEquals(ResolutionOutcome.RESERVE_NOT_MET, result.resolution().outcome());
        assertNotNull(auctionService.getAuction(id, null).resolution());
    }

    @Test
    void testCreateAuction_Defaults() {
        AuctionView view = auctionService.createAuction(AuctionParameters.builder()
                .loanReference("analysis-7")
                .createdBy("seller-1")
                .build());

        assertEquals("Unnamed Loan", view.loanName());
        assertEquals(AuctionType.ENGLISH, view.auctionType());
        assertEquals(AuctionPhase.ACTIVE, view.phase());
        assertEquals(NOW, view.startTime());
        assertEquals(NOW.plus(Duration.ofHours(24)), view.endTime());
        assertEquals(0, new BigDecimal("0.01").compareTo(view.bidIncrement()));
        assertEquals(0, BigDecimal.ZERO.compareTo(view.minBid()));
        assertEquals(0, view.bidCount());
    }

    @Test
    void testCreateAuction_MissingType_EnglishWithVisibleLeader() {
        UUID id = auctionService.createAuction(english().auctionType(null).build()).id();
        bid(id, "alice", "1000");

        AuctionView view = auctionService.getAuction(id, null);

        assertEquals(AuctionType.ENGLISH, view.auctionType());
        assertEquals("alice", view.currentLeader().bidderId());
        assertEquals(1, auctionService.getLeaderboard(id).size());
    }

    @Test
    void testCreateAuction_InvalidParameters() {
        InvalidAuctionParametersException ex = assertThrows(InvalidAuctionParametersException.class,
                () -> auctionService.createAuction(english()
                        .minBid(new BigDecimal("-1"))
                        .bidIncrement(BigDecimal.ZERO)
                        .endTime(NOW.minusSeconds(60))
                        .build()));

        assertTrue(ex.getViolations().contains("minBid must not be negative"));
        assertTrue(ex.getViolations().contains("bidIncrement must be greater than zero"));
        assertTrue(ex.getViolations().contains("endTime must be after startTime"));
        assertEquals(0, registry.size());
        verify(auditPublisher, never()).publish(any());
    }

    @Test
    void testPlaceBid_IncrementLaw() {
        UUID id = auctionService.createAuction(english()
                .minBid(new BigDecimal("10"))
                .bidIncrement(new BigDecimal("5"))
                .build()).id();
        assertTrue(bid(id, "alice", "100").isAccepted());

        BidOutcome low = bid(id, "bob", "104");
        BidOutcome exact = bid(id, "bob", "105");

        assertEquals(BidRejectionReason.BELOW_INCREMENT, low.getRejection().reason());
        assertTrue(low.getRejection().message().contains("$105"));
        assertTrue(exact.isAccepted());
    }

    @Test
    void testPlaceBid_UnknownAuction_NotFound() {
        assertThrows(AuctionNotFoundException.class,
                () -> bid(UUID.randomUUID(), "alice", "1000"));
    }

    @Test
    void testPlaceBid_MissingBidder_InvalidBid() {
        UUID id = auctionService.createAuction(english().build()).id();

        assertThrows(InvalidBidException.class,
                () -> auctionService.placeBid(id, " ", "nobody", new BigDecimal("1000")));
    }

    /**
     * Concurrent distinct bids: acceptance order is strictly increasing and
     * the final leader is the maximum accepted amount.
     */
    @Test
    void testPlaceBid_ConcurrentBidders_SingleConsistentLeader() throws Exception {
        UUID id = auctionService.createAuction(english()
                .bidIncrement(new BigDecimal("1"))
                .reservePrice(BigDecimal.ZERO)
                .build()).id();

        int bidders = 48;
        List<BigDecimal> amounts = new ArrayList<>();
        for (int i = 0; i < bidders; i++) {
            amounts.add(new BigDecimal(1000 + 10 * i));
        }
        Collections.shuffle(amounts);

        AtomicBoolean running = new AtomicBoolean(true);
        AtomicReference<String> readerFailure = new AtomicReference<>();
        Future<?> reader = pool.submit(() -> {
            BigDecimal last = BigDecimal.ZERO;
            while (running.get()) {
                LeaderEntry leader = auctionService.getAuction(id, null).currentLeader();
                if (leader != null) {
                    if (leader.amount().compareTo(last) < 0) {
                        readerFailure.set("leader went from " + last + " to " + leader.amount());
                    }
                    last = leader.amount();
                }
            }
        });

        CountDownLatch start = new CountDownLatch(1);
        List<Future<BidOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < bidders; i++) {
            String bidder = "bidder-" + i;
            BigDecimal amount = amounts.get(i);
            futures.add(pool.submit(() -> {
                start.await();
                return auctionService.placeBid(id, bidder, bidder, amount);
            }));
        }
        start.countDown();

        List<BigDecimal> accepted = new ArrayList<>();
        for (Future<BidOutcome> future : futures) {
            BidOutcome outcome = future.get(10, TimeUnit.SECONDS);
            if (outcome.isAccepted()) {
                accepted.add(outcome.getBid().amount());
            } else {
                assertEquals(BidRejectionReason.BELOW_INCREMENT, outcome.getRejection().reason());
            }
        }
        running.set(false);
        reader.get(5, TimeUnit.SECONDS);

        List<BidView> bids = auctionService.listBids(id, null);
        assertEquals(accepted.size(), bids.size());
        for (int k = 1; k < bids.size(); k++) {
            BigDecimal required = bids.get(k - 1).amount().add(BigDecimal.ONE);
            assertTrue(bids.get(k).amount().compareTo(required) >= 0,
                    "bid " + k + " accepted below previous + increment");
        }
        BigDecimal max = accepted.stream().max(BigDecimal::compareTo).orElseThrow();
        assertEquals(0, new BigDecimal(1000 + 10 * (bidders - 1)).compareTo(max));
        assertEquals(0, max.compareTo(auctionService.getAuction(id, null).currentLeader().amount()));
        assertNull(readerFailure.get(), readerFailure.get());
    }

    /**
     * After close, bids are rejected and close returns the same resolution.
     */
    @Test
    void testCloseAuction_TerminalAndIdempotent() {
        UUID id = auctionService.createAuction(english().build()).id();
        bid(id, "alice", "1300");

        CloseResult first = auctionService.closeAuction(id, "seller-1");
        BidOutcome late = bid(id, "bob", "9000");
        timeSource.advance(Duration.ofMinutes(5));
        CloseResult second = auctionService.closeAuction(id, "seller-1");

        assertEquals(BidRejectionReason.AUCTION_CLOSED, late.getRejection().reason());
        assertFalse(first.alreadyClosed());
        assertTrue(second.alreadyClosed());
        assertSame(first.resolution(), second.resolution());
        assertEquals(1, auctionService.listBids(id, null).size());
        verify(broadcaster, times(1)).auctionClosed(any());
        verify(auditPublisher, times(1)).publish(argThat(r -> "auction.closed".equals(r.eventType())));
    }

    /**
     * Highest bid under reserve closes with no winner.
     */
    @Test
    void testCloseAuction_ReserveNotMet() {
        UUID id = auctionService.createAuction(english()
                .minBid(new BigDecimal("100"))
                .reservePrice(new BigDecimal("1000"))
                .build()).id();
        bid(id, "alice", "900");

        CloseResult result = auctionService.closeAuction(id, "seller-1");

        assertEquals(ResolutionOutcome.RESERVE_NOT_MET, result.resolution().outcome());
        assertTrue(auctionService.listBids(id, null).stream().noneMatch(BidView::winning));
        assertNull(auctionService.getAuction(id, null).resolution().winningBidId());
    }

    /**
     * Close with zero bids.
     */
    @Test
    void testCloseAuction_NoBids() {
        UUID id = auctionService.createAuction(english().build()).id();

        CloseResult result = auctionService.closeAuction(id, "seller-1");

        assertEquals(ResolutionOutcome.NO_BIDS, result.resolution().outcome());
        assertEquals(AuctionPhase.CLOSED, auctionService.getAuction(id, null).phase());
    }

    @Test
    void testCloseAuction_PendingAuction_ClosesWithNoBids() {
        UUID id = auctionService.createAuction(english()
                .startTime(NOW.plus(Duration.ofHours(1)))
                .endTime(NOW.plus(Duration.ofHours(2)))
                .build()).id();

        CloseResult result = auctionService.closeAuction(id, "seller-1");

        assertEquals(ResolutionOutcome.NO_BIDS, result.resolution().outcome());
        assertEquals(AuctionPhase.CLOSED, auctionService.getAuction(id, null).phase());
    }

    /**
     * Sealed-bid amounts stay private until close.
     */
    @Test
    void testSealedBid_AmountsHiddenUntilClose() {
        UUID id = auctionService.createAuction(english()
                .auctionType(AuctionType.SEALED_BID)
                .build()).id();
        bid(id, "alice", "1300");
        bid(id, "bob", "1600");

        AuctionView aliceView = auctionService.getAuction(id, "alice");
        assertNull(aliceView.currentLeader());
        assertNull(aliceView.minimumNextBid());
        assertEquals(2, aliceView.bidCount());
        assertEquals(1, aliceView.ownBids().size());
        assertEquals(0, new BigDecimal("1300").compareTo(aliceView.ownBids().get(0).amount()));
        assertTrue(auctionService.getLeaderboard(id).isEmpty());
        assertEquals(1, auctionService.listBids(id, "alice").size());
        assertTrue(auctionService.listBids(id, null).isEmpty());

        CloseResult result = auctionService.closeAuction(id, "seller-1");

        assertEquals("bob", result.resolution().winningBidderId());
        assertEquals(2, result.resolution().revealedBids().size());
        assertEquals(2, auctionService.getLeaderboard(id).size());
        assertEquals(2, auctionService.listBids(id, null).size());
    }

    @Test
    void testGetAuction_EnglishActive_ShowsLeaderAndNextMinimum() {
        UUID id = auctionService.createAuction(english().build()).id();
        bid(id, "alice", "1000");
        bid(id, "bob", "1100");

        AuctionView view = auctionService.getAuction(id, null);

        assertEquals("bob", view.currentLeader().bidderId());
        assertEquals(1, view.currentLeader().rank());
        assertEquals(0, new BigDecimal("1150").compareTo(view.minimumNextBid()));
        assertNull(view.ownBids());
    }

    @Test
    void testPlaceBid_LockHeld_TimesOutAndBidNeverRecorded() throws Exception {
        AuctionProperties shortTimeout = new AuctionProperties();
        shortTimeout.setLockTimeout(Duration.ofMillis(50));
        AuctionService service = newService(shortTimeout, auditPublisher);
        UUID id = service.createAuction(english().build()).id();

        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> holder = pool.submit(() -> lockManager.withAuctionLock(id, () -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        assertTrue(held.await(5, TimeUnit.SECONDS));

        assertThrows(AuctionLockTimeoutException.class,
                () -> service.placeBid(id, "alice", "Alice", new BigDecimal("1000")));
        release.countDown();
        holder.get(5, TimeUnit.SECONDS);

        assertTrue(service.listBids(id, null).isEmpty());
        assertTrue(service.placeBid(id, "alice", "Alice", new BigDecimal("1000")).isAccepted());
    }

    @Test
    void testPlaceBid_AuditFailure_DoesNotUndoBid() {
        AuditSink failing = mock(AuditSink.class);
        doThrow(new IllegalStateException("audit store down")).when(failing).record(any());
        AuctionService service = newService(properties, new AuditPublisher(failing));
        UUID id = service.createAuction(english().build()).id();

        BidOutcome outcome = service.placeBid(id, "alice", "Alice", new BigDecimal("1000"));

        assertTrue(outcome.isAccepted());
        assertEquals(1, service.listBids(id, null).size());
        verify(failing, times(2)).record(any(AuditRecord.class));
    }

    @Test
    void testPlaceBid_EmitsAuditForAcceptAndReject() {
        UUID id = auctionService.createAuction(english().build()).id();

        bid(id, "alice", "1000");
        bid(id, "bob", "1010");

        verify(auditPublisher).publish(argThat(r -> "bid.accepted".equals(r.eventType())
                && "alice".equals(r.userId())
                && "bid".equals(r.entityType())));
        verify(auditPublisher).publish(argThat(r -> "bid.rejected".equals(r.eventType())
                && "BELOW_INCREMENT".equals(r.details().get("reason"))
                && id.toString().equals(r.entityId())));
        verify(broadcaster, times(1)).bidPlaced(any(), any());
    }

    @Test
    void testListAuctionsForLoan_NewestFirst() {
        UUID first = auctionService.createAuction(english().build()).id();
        timeSource.advance(Duration.ofSeconds(1));
        UUID second = auctionService.createAuction(english().build()).id();
        auctionService.createAuction(english().loanReference("other-loan").build());

        List<AuctionView> views = auctionService.listAuctionsForLoan("analysis-42");

        assertEquals(2, views.size());
        assertEquals(second, views.get(0).id());
        assertEquals(first, views.get(1).id());
    }
}
