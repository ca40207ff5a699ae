package com.flagship.crypto_settlement.settlement;

import com.flagship.crypto_settlement.invoice.Invoice;
import com.flagship.crypto_settlement.invoice.InvoiceStatus;
import com.flagship.crypto_settlement.invoice.InvoiceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Checks an invoice's status before any settlement side effect.
 *
 * PAID, CANCELED and EXPIRED invoices are rejected. An invoice whose
 * {@code expiresAt} has passed is moved to EXPIRED here and rejected.
 */
@Component
@Slf4j
public class PaymentAttemptValidator {

    private final InvoiceStore invoiceStore;
    private final Clock clock;

    @Autowired
    public PaymentAttemptValidator(InvoiceStore invoiceStore) {
        this(invoiceStore, Clock.systemUTC());
    }

    PaymentAttemptValidator(InvoiceStore invoiceStore, Clock clock) {
        this.invoiceStore = invoiceStore;
        this.clock = clock;
    }

    public AttemptValidation validate(UUID invoiceId) {
        Optional<Invoice> found = invoiceStore.findById(invoiceId);
        if (found.isEmpty()) {
            return AttemptValidation.rejected("Invoice not found", null,
                "Contact merchant for a new payment link");
        }
        Invoice invoice = found.get();

        return switch (invoice.getStatus()) {
            case PAID -> {
                log.warn("Payment attempt on already paid invoice: invoiceId={}", invoiceId);
                yield AttemptValidation.rejected("This invoice has already been paid", InvoiceStatus.PAID,
                    "Contact merchant if you believe this is an error");
            }
            case CANCELED -> {
                log.warn("Payment attempt on canceled invoice: invoiceId={}", invoiceId);
                yield AttemptValidation.rejected("This invoice has been canceled", InvoiceStatus.CANCELED,
                    "Request a new payment link from the merchant");
            }
            case EXPIRED -> expired(invoiceId);
            case DRAFT, OPEN -> {
                if (invoice.isPastExpiry(clock.instant())) {
                    log.warn("Payment attempt on expired invoice: invoiceId={}, expiresAt={}",
                        invoiceId, invoice.getExpiresAt());
                    invoiceStore.expire(invoiceId);
                    yield expired(invoiceId);
                }
                yield AttemptValidation.allowed(invoice.getStatus());
            }
        };
    }

    private AttemptValidation expired(UUID invoiceId) {
        return AttemptValidation.rejected("This invoice has expired", InvoiceStatus.EXPIRED,
            "Request a new payment link from the merchant");
    }
}
