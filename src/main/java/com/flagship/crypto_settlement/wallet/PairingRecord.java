package com.flagship.crypto_settlement.wallet;

import lombok.Value;

import java.util.List;

/**
 * Wallet to dApp relationship delivered by the pairing event.
 *
 * The pairing topic identifies the relationship only. Transactions are
 * signed over a session topic, see {@link SessionRecord}.
 */
@Value
public class PairingRecord {
    String pairingTopic;
    List<String> accountIds;
    String network;

    public PairingRecord(String pairingTopic, List<String> accountIds, String network) {
        if (pairingTopic == null || pairingTopic.isBlank()) {
            throw new IllegalArgumentException("Pairing topic is required");
        }
        this.pairingTopic = pairingTopic;
        this.accountIds = accountIds == null ? List.of() : List.copyOf(accountIds);
        this.network = network;
    }

    /**
     * First paired account, or null when the wallet shared none.
     */
    public String primaryAccountId() {
        return accountIds.isEmpty() ? null : accountIds.get(0);
    }
}
