package com.flagship.crypto_settlement.ledger;

import com.flagship.crypto_settlement.hedera.HederaToken;

import java.util.Arrays;
import java.util.Optional;

/**
 * Account codes used by crypto settlement.
 *
 * Each token settles into its own clearing account so balances per asset
 * stay reconcilable against the chain: HBAR 1051, USDC 1052, USDT 1053,
 * AUDD 1054. The receivable side is always 1200.
 */
public final class LedgerAccountCodes {

    public static final String ACCOUNTS_RECEIVABLE = "1200";
    public static final String ACCOUNTS_RECEIVABLE_NAME = "Accounts Receivable";

    private LedgerAccountCodes() {
    }

    public static String clearingCode(HederaToken token) {
        return token.getClearingAccountCode();
    }

    public static String clearingName(HederaToken token) {
        return "Crypto Clearing - " + token.name();
    }

    public static boolean isCryptoClearing(String code) {
        return tokenForClearingCode(code).isPresent();
    }

    public static Optional<HederaToken> tokenForClearingCode(String code) {
        return Arrays.stream(HederaToken.values())
            .filter(token -> token.getClearingAccountCode().equals(code))
            .findFirst();
    }
}
