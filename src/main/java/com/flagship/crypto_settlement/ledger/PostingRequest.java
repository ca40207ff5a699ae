package com.flagship.crypto_settlement.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A balanced set of debits and credits for one invoice.
 *
 * Invariant: sum of debits equals sum of credits. Every line carries its
 * own idempotency key so a replayed posting is recognized line by line.
 */
@Value
public class PostingRequest {
    UUID invoiceId;
    String correlationId;
    String description;
    String currency;
    List<Line> debits;
    List<Line> credits;

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }

    public BigDecimal getDebitTotal() {
        return debits.stream()
            .map(Line::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return credits.stream()
            .map(Line::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<String> idempotencyKeys() {
        List<String> keys = new ArrayList<>();
        debits.forEach(line -> keys.add(line.getIdempotencyKey()));
        credits.forEach(line -> keys.add(line.getIdempotencyKey()));
        return keys;
    }

    /**
     * One debit or credit line.
     */
    @Value
    public static class Line {
        UUID accountId;
        BigDecimal amount;
        String idempotencyKey;
        String description;

        private Line(UUID accountId, BigDecimal amount, String idempotencyKey, String description) {
            this.accountId = Objects.requireNonNull(accountId);
            this.amount = Objects.requireNonNull(amount);
            if (amount.compareTo(BigDecimal.ZERO) <= 0) {
                throw new IllegalArgumentException("Amount must be positive");
            }
            this.idempotencyKey = Objects.requireNonNull(idempotencyKey);
            this.description = description;
        }

        public static Line of(UUID accountId, BigDecimal amount, String idempotencyKey, String description) {
            return new Line(accountId, amount, idempotencyKey, description);
        }
    }
}
