package com.flagship.crypto_settlement.ledger;

/**
 * Side of a ledger entry. ASSET accounts increase on DEBIT.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
