package com.flagship.crypto_settlement.mirror;

import lombok.Value;

import java.time.Instant;

/**
 * Parameters of a newest-first transaction page lookup for one account.
 */
@Value
public class TransactionQuery {
    String accountId;
    int limit;
    Instant since;
    String transactionType;
}
