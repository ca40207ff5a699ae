package com.flagship.crypto_settlement.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Result of {@link LedgerService#post(PostingRequest)}.
 * {@code alreadyPosted} means every line existed and nothing was written.
 */
@Value
public class PostingResult {
    UUID transactionId;
    int entriesWritten;
    boolean alreadyPosted;
}
