package com.flagship.crypto_settlement.invoice;

/**
 * Lifecycle of an invoice as seen by the settlement core.
 *
 * Only DRAFT and OPEN invoices can still be paid. PAID, EXPIRED and
 * CANCELED are terminal.
 */
public enum InvoiceStatus {
    /**
     * Created but not yet sent to the payer.
     */
    DRAFT,

    /**
     * Awaiting payment.
     */
    OPEN,

    /**
     * Payment confirmed. Set exactly once, by settlement.
     */
    PAID,

    /**
     * Payment window closed before a payment was confirmed.
     */
    EXPIRED,

    /**
     * Withdrawn by the merchant.
     */
    CANCELED;

    public boolean isTerminal() {
        return this == PAID || this == EXPIRED || this == CANCELED;
    }
}
