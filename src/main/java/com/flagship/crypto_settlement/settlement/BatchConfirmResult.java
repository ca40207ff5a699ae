package com.flagship.crypto_settlement.settlement;

import lombok.Value;

import java.util.UUID;

/**
 * One item of {@link SettlementPoster#batchConfirm}. Exactly one of
 * {@code result} and {@code error} is set.
 */
@Value
public class BatchConfirmResult {
    UUID invoiceId;
    boolean success;
    SettlementResult result;
    String error;
}
