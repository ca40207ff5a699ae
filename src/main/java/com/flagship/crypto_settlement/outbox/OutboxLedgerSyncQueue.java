package com.flagship.crypto_settlement.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Sync queue backed by the outbox; {@link OutboxPublisher} delivers the jobs
 * to the {@code ledger-sync} topic keyed by invoice id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxLedgerSyncQueue implements LedgerSyncQueue {

    public static final String AGGREGATE_TYPE = "Invoice";

    private final OutboxService outboxService;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void enqueue(UUID invoiceId, UUID organizationId, String correlationId) {
        outboxService.saveEvent(AGGREGATE_TYPE, invoiceId, LedgerSyncRequested.EVENT_TYPE,
            new LedgerSyncRequested(invoiceId, organizationId, correlationId, Instant.now()));
        log.info("Ledger sync queued: invoiceId={}, organizationId={}", invoiceId, organizationId);
    }
}
