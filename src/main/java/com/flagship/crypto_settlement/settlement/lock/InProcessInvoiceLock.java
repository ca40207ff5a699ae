package com.flagship.crypto_settlement.settlement.lock;

import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyed mutex for a single JVM. Entries are dropped when released so the
 * map only holds invoices currently being settled.
 */
@Slf4j
public class InProcessInvoiceLock implements InvoiceLock {

    private final ConcurrentMap<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(UUID invoiceId) {
        AtomicBoolean acquired = new AtomicBoolean(false);
        locks.compute(invoiceId, (id, existing) -> {
            ReentrantLock lock = existing != null ? existing : new ReentrantLock();
            acquired.set(lock.tryLock());
            return lock;
        });
        if (acquired.get()) {
            log.debug("Invoice lock acquired: invoiceId={}", invoiceId);
        } else {
            log.warn("Failed to acquire invoice lock: invoiceId={}", invoiceId);
        }
        return acquired.get();
    }

    @Override
    public void release(UUID invoiceId) {
        locks.computeIfPresent(invoiceId, (id, lock) -> {
            if (!lock.isHeldByCurrentThread()) {
                log.warn("Release of invoice lock not held by this thread ignored: invoiceId={}", invoiceId);
                return lock;
            }
            lock.unlock();
            return lock.isLocked() ? lock : null;
        });
        log.debug("Invoice lock released: invoiceId={}", invoiceId);
    }

    int heldCount() {
        return locks.size();
    }
}
