package com.loanauction.service;

import com.loanauction.config.AuctionProperties;
import com.loanauction.exception.AuctionLockTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-auction mutual exclusion.
 *
 * <p>One fair lock per auction id, created on first use and kept. Work run
 * under {@link #withAuctionLock} for the same id never overlaps; different ids
 * never wait on each other. Bids are accepted in the order their callers
 * acquire the lock, which is not necessarily the order the requests reached
 * the server.</p>
 */
@Component
public class AuctionLockManager {

    private static final Logger log = LoggerFactory.getLogger(AuctionLockManager.class);

    private final ConcurrentHashMap<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public AuctionLockManager(AuctionProperties properties) {
        this.timeout = properties.getLockTimeout();
    }

    /**
     * Runs {@code action} while holding the lock for {@code auctionId}.
     *
     * @throws AuctionLockTimeoutException if the lock is not acquired within the
     *         configured timeout; {@code action} has not run
     */
    public <T> T withAuctionLock(UUID auctionId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(auctionId, id -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuctionLockTimeoutException(auctionId, timeout, e);
        }
        if (!acquired) {
            log.warn("Lock timeout on auction {} after {} ms, {} waiting",
                    auctionId, timeout.toMillis(), lock.getQueueLength());
            throw new AuctionLockTimeoutException(auctionId, timeout);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
