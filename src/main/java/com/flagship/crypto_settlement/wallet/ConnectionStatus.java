package com.flagship.crypto_settlement.wallet;

/**
 * Relay connection states reported by the wallet connector.
 */
public enum ConnectionStatus {
    CONNECTED,
    PAIRED,
    DISCONNECTED
}
