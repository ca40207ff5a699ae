package com.flagship.crypto_settlement.settlement;

import com.flagship.crypto_settlement.hedera.TransactionIdNormalizer;

/**
 * Deterministic correlation ids for on-chain payments.
 *
 * {@code hedera_0.0.123-1700000000-000000001}: the network prefix plus the
 * normalized transaction id, so both wire formats of one transaction map to
 * the same id. Ledger idempotency keys append {@code -debit} / {@code -credit}.
 */
public final class CorrelationIds {

    public static final String HEDERA_PREFIX = "hedera";

    private CorrelationIds() {
    }

    public static String forHederaTransaction(String transactionId) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new IllegalArgumentException("Transaction id is required");
        }
        return HEDERA_PREFIX + "_" + TransactionIdNormalizer.normalize(transactionId.trim());
    }

    public static String debitKey(String correlationId) {
        return correlationId + "-debit";
    }

    public static String creditKey(String correlationId) {
        return correlationId + "-credit";
    }
}
