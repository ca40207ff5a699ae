package com.flagship.crypto_settlement.mirror;

import lombok.Value;

import java.math.BigInteger;

/**
 * A token association from {@code /api/v1/accounts/{id}/tokens}.
 */
@Value
public class TokenRelationship {
    String tokenId;
    BigInteger balance;
    boolean automaticAssociation;
}
