package com.flagship.crypto_settlement.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * An immutable ledger line. Entries are never updated or deleted.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    UUID invoiceId;
    UUID accountId;
    BigDecimal amount;
    String currency;
    EntryType entryType;
    String description;
    String idempotencyKey;
    long sequenceNumber;
}
