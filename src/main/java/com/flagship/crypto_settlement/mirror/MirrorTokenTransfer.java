package com.flagship.crypto_settlement.mirror;

import lombok.Value;

/**
 * One HTS token leg of a mirror node transaction, in signed token smallest units.
 */
@Value
public class MirrorTokenTransfer {
    String tokenId;
    String account;
    long amount;
    boolean approval;
}
