package com.flagship.crypto_settlement.mirror;

import lombok.Value;

/**
 * One HBAR leg of a mirror node transaction. Amounts are signed tinybars:
 * positive for the receiving account, negative for the paying account.
 */
@Value
public class MirrorTransfer {
    String account;
    long amount;
    boolean approval;
}
