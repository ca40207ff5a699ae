package com.flagship.crypto_settlement.mirror;

import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Balances of an account from {@code /api/v1/accounts/{id}}.
 * Token balances are keyed by token id and held in smallest units.
 */
@Value
public class AccountSnapshot {
    String accountId;
    BigInteger tinybars;
    Map<String, BigInteger> tokenBalances;

    public BigInteger tokenBalance(String tokenId) {
        return tokenBalances.getOrDefault(tokenId, BigInteger.ZERO);
    }
}
