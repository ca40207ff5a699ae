package com.flagship.crypto_settlement.settlement;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of one settlement.
 *
 * A CONFIRMED result with {@code ledgerPosted == false} means the invoice is
 * PAID and the event recorded, but the ledger entries still need
 * {@link SettlementPoster#retryLedgerPosting(UUID)}.
 */
@Value
public class SettlementResult {

    public enum Outcome {
        /** Invoice moved to PAID by this call. */
        CONFIRMED,
        /** The transaction was already recorded; nothing written. */
        DUPLICATE,
        /** The invoice turned PAID while waiting for the lock; nothing written. */
        ALREADY_PAID
    }

    UUID invoiceId;
    Outcome outcome;
    String correlationId;
    String transactionId;
    boolean ledgerPosted;
    String ledgerError;
    boolean syncQueued;

    static SettlementResult confirmed(UUID invoiceId, String correlationId, String transactionId,
                                      LedgerPosting posting, boolean syncQueued) {
        return new SettlementResult(invoiceId, Outcome.CONFIRMED, correlationId, transactionId,
            posting.isPosted(), posting.getError(), syncQueued);
    }

    static SettlementResult duplicate(UUID invoiceId, String correlationId, String transactionId) {
        return new SettlementResult(invoiceId, Outcome.DUPLICATE, correlationId, transactionId, false, null, false);
    }

    static SettlementResult alreadyPaid(UUID invoiceId, String correlationId, String transactionId) {
        return new SettlementResult(invoiceId, Outcome.ALREADY_PAID, correlationId, transactionId, false, null, false);
    }

    public boolean isNewlyConfirmed() {
        return outcome == Outcome.CONFIRMED;
    }
}
