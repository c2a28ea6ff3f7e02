package com.lendora.lending.service;

import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.exception.ConcurrencyConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process exclusive locks keyed by loan and by collateral position.
 *
 * Callers that need both take the loan lock first, then the position lock.
 */
@Component
@Slf4j
public class LoanLockRegistry {

    private final ConcurrentMap<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public LoanLockRegistry(LendingProperties properties) {
        this.waitTimeout = properties.getLocking().getWaitTimeout();
    }

    public static String loanKey(Long loanId) {
        return "loan:" + loanId;
    }

    public static String positionKey(String borrowerId, String assetId) {
        return "position:" + borrowerId + ":" + assetId;
    }

    public <T> T withLoanAndPosition(Long loanId, String borrowerId, String assetId, Supplier<T> action) {
        return withLock(loanKey(loanId), () -> withLock(positionKey(borrowerId, assetId), action));
    }

    public <T> T withPosition(String borrowerId, String assetId, Supplier<T> action) {
        return withLock(positionKey(borrowerId, assetId), action);
    }

    /**
     * Runs the action while holding the lock for {@code key}.
     *
     * <p>An entry lives only while some thread holds or waits for it; the last one out removes it,
     * so the registry stays as large as the set of keys currently in use.
     *
     * @throws ConcurrencyConflictException if the lock is not acquired within the configured wait
     */
    public <T> T withLock(String key, Supplier<T> action) {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry held = existing != null ? existing : new LockEntry();
            held.users++;
            return held;
        });
        try {
            acquire(key, entry.lock);
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(key, (k, held) -> --held.users == 0 ? null : held);
        }
    }

    private void acquire(String key, ReentrantLock lock) {
        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException("Interrupted while waiting for " + key, e);
        }
        if (!acquired) {
            log.warn("Lock {} not acquired within {}", key, waitTimeout);
            throw new ConcurrencyConflictException("Another operation holds " + key + ", retry later");
        }
    }

    public boolean isLocked(String key) {
        LockEntry entry = locks.get(key);
        return entry != null && entry.lock.isLocked();
    }

    /**
     * Number of keys currently held or waited on.
     */
    public int size() {
        return locks.size();
    }

    // users is only read and written inside ConcurrentHashMap.compute for the entry's key
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
