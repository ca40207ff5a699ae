package com.flagship.crypto_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_settlement.settlement.LedgerRetryResult;
import lombok.Value;

import java.util.UUID;

@Value
public class LedgerRetryResponse {

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("status")
    LedgerRetryResult.Status status;

    @JsonProperty("correlation_id")
    String correlationId;

    @JsonProperty("sync_queued")
    boolean syncQueued;

    public static LedgerRetryResponse from(LedgerRetryResult result) {
        return new LedgerRetryResponse(result.getInvoiceId(), result.getStatus(),
            result.getCorrelationId(), result.isSyncQueued());
    }
}
