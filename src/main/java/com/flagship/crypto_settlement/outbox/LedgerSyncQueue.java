package com.flagship.crypto_settlement.outbox;

import java.util.UUID;

/**
 * Outbound queue of external-ledger sync jobs, keyed by invoice.
 */
public interface LedgerSyncQueue {

    void enqueue(UUID invoiceId, UUID organizationId, String correlationId);
}
