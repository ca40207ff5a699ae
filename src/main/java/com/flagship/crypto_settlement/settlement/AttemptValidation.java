package com.flagship.crypto_settlement.settlement;

import com.flagship.crypto_settlement.invoice.InvoiceStatus;
import lombok.Value;

/**
 * Whether an invoice may still receive a payment. {@code currentStatus} is
 * null when the invoice does not exist.
 */
@Value
public class AttemptValidation {
    boolean allowed;
    String reason;
    InvoiceStatus currentStatus;
    String suggestedAction;

    public static AttemptValidation allowed(InvoiceStatus status) {
        return new AttemptValidation(true, null, status, null);
    }

    public static AttemptValidation rejected(String reason, InvoiceStatus status, String suggestedAction) {
        return new AttemptValidation(false, reason, status, suggestedAction);
    }
}
