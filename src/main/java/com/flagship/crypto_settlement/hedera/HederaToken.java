package com.flagship.crypto_settlement.hedera;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;

/**
 * Assets accepted for invoice settlement.
 *
 * HBAR is the native asset (no token id, 8 decimals). The others are HTS
 * stablecoins with 6 decimals. Tolerances are fractions of the required
 * amount: wider for the volatile native asset, narrow for stablecoins.
 */
public enum HederaToken {

    /** Native asset. Smallest unit is the tinybar. */
    HBAR(8, new BigDecimal("0.005"), null, null, "1051"),

    USDC(6, new BigDecimal("0.001"), "0.0.456858", "0.0.429274", "1052"),

    USDT(6, new BigDecimal("0.001"), "0.0.8322281", "0.0.429275", "1053"),

    /** Australian Digital Dollar. */
    AUDD(6, new BigDecimal("0.001"), "0.0.1394325", "0.0.4918852", "1054");

    private final int decimals;
    private final BigDecimal tolerance;
    private final String mainnetTokenId;
    private final String testnetTokenId;
    private final String clearingAccountCode;

    HederaToken(int decimals, BigDecimal tolerance, String mainnetTokenId,
                String testnetTokenId, String clearingAccountCode) {
        this.decimals = decimals;
        this.tolerance = tolerance;
        this.mainnetTokenId = mainnetTokenId;
        this.testnetTokenId = testnetTokenId;
        this.clearingAccountCode = clearingAccountCode;
    }

    public int getDecimals() {
        return decimals;
    }

    public BigDecimal getTolerance() {
        return tolerance;
    }

    public String getClearingAccountCode() {
        return clearingAccountCode;
    }

    public boolean isNative() {
        return this == HBAR;
    }

    public boolean isStablecoin() {
        return !isNative();
    }

    /**
     * HTS token id on the given network. Previewnet shares the testnet ids.
     *
     * @throws IllegalStateException for HBAR, which has no token id
     */
    public String tokenId(HederaNetwork network) {
        if (isNative()) {
            throw new IllegalStateException("HBAR is the native asset and has no token id");
        }
        return network == HederaNetwork.MAINNET ? mainnetTokenId : testnetTokenId;
    }

    /**
     * Mirror node transactionType filter for transfers of this asset.
     */
    public String transactionTypeFilter() {
        return isNative() ? "CRYPTOTRANSFER" : "CRYPTOTRANSFER,TOKENTRANSFER";
    }

    public static Optional<HederaToken> fromTokenId(String tokenId, HederaNetwork network) {
        return Arrays.stream(values())
            .filter(HederaToken::isStablecoin)
            .filter(token -> token.tokenId(network).equals(tokenId))
            .findFirst();
    }
}
