package com.flagship.crypto_settlement.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Asks the external accounting sync to pick up a settled invoice.
 */
@Value
public class LedgerSyncRequested {
    public static final String EVENT_TYPE = "LedgerSyncRequested";

    UUID invoiceId;
    UUID organizationId;
    String correlationId;
    Instant requestedAt;
}
