package com.flagship.crypto_settlement.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Invoice domain object.
 *
 * The settlement core never creates or edits invoices; it only reads them
 * and moves them to PAID (or EXPIRED when the payment window has passed).
 * Transitions return a new instance and reject invalid moves.
 */
@Value
public class Invoice {
    UUID id;
    UUID organizationId;
    BigDecimal amount;
    CurrencyCode currency;
    InvoiceStatus status;
    Instant expiresAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates an OPEN invoice. Used by fixtures and by the external store's adapters.
     */
    public static Invoice open(UUID id, UUID organizationId, BigDecimal amount,
                               CurrencyCode currency, Instant expiresAt) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Invoice amount must be positive");
        }
        Instant now = Instant.now();
        return new Invoice(id, organizationId, amount, currency, InvoiceStatus.OPEN, expiresAt, now, now);
    }

    /**
     * Transitions the invoice to PAID.
     *
     * @throws IllegalStateException if the invoice is already terminal
     */
    public Invoice markPaid() {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot mark invoice %s as PAID from %s status.", id, status));
        }
        return withStatus(InvoiceStatus.PAID);
    }

    /**
     * Transitions the invoice to EXPIRED.
     *
     * @throws IllegalStateException if the invoice is already terminal
     */
    public Invoice expire() {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot expire invoice %s in %s status.", id, status));
        }
        return withStatus(InvoiceStatus.EXPIRED);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * True when the payment window has closed but the status has not caught up yet.
     */
    public boolean isPastExpiry(Instant now) {
        return expiresAt != null && !status.isTerminal() && now.isAfter(expiresAt);
    }

    private Invoice withStatus(InvoiceStatus next) {
        return new Invoice(id, organizationId, amount, currency, next, expiresAt, createdAt, Instant.now());
    }
}
