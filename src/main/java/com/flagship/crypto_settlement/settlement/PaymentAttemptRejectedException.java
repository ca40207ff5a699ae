package com.flagship.crypto_settlement.settlement;

import lombok.Getter;

import java.util.UUID;

/**
 * The invoice can no longer accept a payment (paid, canceled, expired or missing).
 */
@Getter
public class PaymentAttemptRejectedException extends RuntimeException {

    private final UUID invoiceId;
    private final AttemptValidation validation;

    public PaymentAttemptRejectedException(UUID invoiceId, AttemptValidation validation) {
        super(validation.getReason());
        this.invoiceId = invoiceId;
        this.validation = validation;
    }
}
