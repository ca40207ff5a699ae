package com.flagship.crypto_settlement.settlement;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only record that an invoice was paid on-chain.
 *
 * {@code hederaTransactionId} is always stored in normalized (dash) form;
 * the id exactly as received is kept in metadata under
 * {@code raw_transaction_id}.
 */
@Value
public class PaymentEvent {

    public static final String PAYMENT_METHOD_HEDERA = "HEDERA";

    UUID id;
    UUID invoiceId;
    PaymentEventType eventType;
    String paymentMethod;
    String hederaTransactionId;
    BigDecimal amountReceived;
    String currencyReceived;
    String correlationId;
    Map<String, Object> metadata;
    Instant createdAt;

    public static PaymentEvent confirmed(UUID invoiceId, String normalizedTransactionId, BigDecimal amountReceived,
                                         String currencyReceived, String correlationId, Map<String, Object> metadata) {
        return new PaymentEvent(
            UUID.randomUUID(),
            invoiceId,
            PaymentEventType.PAYMENT_CONFIRMED,
            PAYMENT_METHOD_HEDERA,
            normalizedTransactionId,
            amountReceived,
            currencyReceived,
            correlationId,
            Collections.unmodifiableMap(new LinkedHashMap<>(metadata)),
            Instant.now()
        );
    }
}
