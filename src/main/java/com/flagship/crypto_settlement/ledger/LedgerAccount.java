package com.flagship.crypto_settlement.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * A chart-of-accounts entry owned by one organization, unique per
 * (organization, code).
 */
@Value
public class LedgerAccount {
    UUID id;
    UUID organizationId;
    String code;
    String name;
    AccountType accountType;

    public enum AccountType {
        ASSET,
        LIABILITY,
        EQUITY,
        REVENUE,
        EXPENSE
    }
}
