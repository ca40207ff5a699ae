package com.flagship.crypto_settlement.hedera;

import java.util.Locale;

/**
 * Hedera networks the settlement core can be pointed at.
 *
 * Each network carries the public mirror node base URL used for
 * transaction detection and account snapshots.
 */
public enum HederaNetwork {
    MAINNET("https://mainnet-public.mirrornode.hedera.com"),
    TESTNET("https://testnet.mirrornode.hedera.com"),
    PREVIEWNET("https://previewnet.mirrornode.hedera.com");

    private final String mirrorNodeUrl;

    HederaNetwork(String mirrorNodeUrl) {
        this.mirrorNodeUrl = mirrorNodeUrl;
    }

    public String getMirrorNodeUrl() {
        return mirrorNodeUrl;
    }

    /**
     * Lower-case name as used in configuration and event metadata ("testnet").
     */
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static HederaNetwork fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Hedera network must not be blank");
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown Hedera network: " + id, e);
        }
    }
}
