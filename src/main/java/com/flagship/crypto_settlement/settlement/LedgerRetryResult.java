package com.flagship.crypto_settlement.settlement;

import lombok.Value;

import java.util.UUID;

@Value
public class LedgerRetryResult {

    public enum Status {
        POSTED,
        ALREADY_POSTED
    }

    UUID invoiceId;
    Status status;
    String correlationId;
    boolean syncQueued;
}
