package com.flagship.crypto_settlement.wallet;

import lombok.Value;

import java.util.Set;

/**
 * One entry of a connector session registry.
 */
@Value
public class SessionRecord {

    public static final String HEDERA_NAMESPACE = "hedera";

    String topic;
    Set<String> namespaces;
    boolean acknowledged;

    public SessionRecord(String topic, Set<String> namespaces, boolean acknowledged) {
        this.topic = topic;
        this.namespaces = namespaces == null ? Set.of() : Set.copyOf(namespaces);
        this.acknowledged = acknowledged;
    }

    /**
     * Acknowledged by the wallet and negotiated for the Hedera namespace.
     */
    public boolean isSigningReady() {
        return topic != null && acknowledged && namespaces.contains(HEDERA_NAMESPACE);
    }
}
