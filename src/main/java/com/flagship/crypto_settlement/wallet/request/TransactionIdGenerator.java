package com.flagship.crypto_settlement.wallet.request;

import java.time.Clock;
import java.time.Instant;

/**
 * Client-side transaction ids, {@code account@seconds.nanos}, taken from
 * the injected clock since no network client assigns one.
 */
public class TransactionIdGenerator {

    private final Clock clock;

    public TransactionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(String payerAccountId) {
        if (payerAccountId == null || payerAccountId.isBlank()) {
            throw new IllegalArgumentException("Payer account id is required");
        }
        Instant validStart = clock.instant();
        return String.format("%s@%d.%09d", payerAccountId, validStart.getEpochSecond(), validStart.getNano());
    }
}
