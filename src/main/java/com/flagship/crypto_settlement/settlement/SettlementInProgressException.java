package com.flagship.crypto_settlement.settlement;

import lombok.Getter;

import java.util.UUID;

/**
 * Another request holds the invoice's settlement lock. Retryable.
 */
@Getter
public class SettlementInProgressException extends RuntimeException {

    private final UUID invoiceId;

    public SettlementInProgressException(UUID invoiceId) {
        super("Payment is being processed by another request");
        this.invoiceId = invoiceId;
    }
}
