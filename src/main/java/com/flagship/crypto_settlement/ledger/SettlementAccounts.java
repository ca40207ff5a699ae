package com.flagship.crypto_settlement.ledger;

import lombok.Value;

/**
 * The account pair a crypto settlement posts against.
 */
@Value
public class SettlementAccounts {
    LedgerAccount clearing;
    LedgerAccount receivable;
}
