package com.flagship.crypto_settlement.wallet.request;

import lombok.Value;

/**
 * One side of a transfer in smallest units. Negative amounts debit the
 * account, positive amounts credit it.
 */
@Value
public class TransferLeg {
    String accountId;
    long amount;

    public static TransferLeg debit(String accountId, long units) {
        return new TransferLeg(accountId, -units);
    }

    public static TransferLeg credit(String accountId, long units) {
        return new TransferLeg(accountId, units);
    }
}
