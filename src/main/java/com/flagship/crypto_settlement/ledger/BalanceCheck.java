package com.flagship.crypto_settlement.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Debit and credit totals of one invoice's ledger entries.
 */
@Value
public class BalanceCheck {
    UUID invoiceId;
    BigDecimal debitTotal;
    BigDecimal creditTotal;
    int entryCount;

    public boolean isBalanced() {
        return debitTotal.compareTo(creditTotal) == 0;
    }

    public BigDecimal getVariance() {
        return debitTotal.subtract(creditTotal).abs();
    }
}
