package com.flagship.crypto_settlement.settlement.lock;

import java.util.UUID;

/**
 * Per-invoice mutual exclusion for settlement.
 *
 * Acquisition never blocks: a caller that loses the race gets {@code false}
 * immediately. The thread that acquired the lock must release it.
 */
public interface InvoiceLock {

    boolean tryAcquire(UUID invoiceId);

    void release(UUID invoiceId);
}
