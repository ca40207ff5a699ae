package com.flagship.crypto_settlement.wallet;

import com.flagship.crypto_settlement.hedera.AmountCodec;
import com.flagship.crypto_settlement.hedera.HederaNetwork;
import com.flagship.crypto_settlement.hedera.HederaToken;
import com.flagship.crypto_settlement.mirror.AccountSnapshot;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Display balances of the paired account, one formatted string per token
 * with the token's full decimal precision ("0.00000000" for HBAR,
 * "0.000000" for the stablecoins).
 */
@EqualsAndHashCode
@ToString
public final class WalletBalances {

    private static final WalletBalances EMPTY = new WalletBalances(zeroes());

    private final Map<HederaToken, String> balances;

    private WalletBalances(Map<HederaToken, String> balances) {
        this.balances = Collections.unmodifiableMap(balances);
    }

    public static WalletBalances empty() {
        return EMPTY;
    }

    public static WalletBalances fromSnapshot(AccountSnapshot snapshot, HederaNetwork network) {
        Map<HederaToken, String> values = new EnumMap<>(HederaToken.class);
        for (HederaToken token : HederaToken.values()) {
            BigInteger units = token.isNative()
                ? snapshot.getTinybars()
                : snapshot.tokenBalance(token.tokenId(network));
            values.put(token, AmountCodec.format(units == null ? BigInteger.ZERO : units, token.getDecimals()));
        }
        return new WalletBalances(values);
    }

    public String get(HederaToken token) {
        return balances.get(token);
    }

    public Map<HederaToken, String> asMap() {
        return balances;
    }

    private static Map<HederaToken, String> zeroes() {
        Map<HederaToken, String> values = new EnumMap<>(HederaToken.class);
        for (HederaToken token : HederaToken.values()) {
            values.put(token, AmountCodec.zero(token.getDecimals()));
        }
        return values;
    }
}
