package com.flagship.crypto_settlement.wallet;

/**
 * Lifecycle of a {@link WalletSessionManager}.
 *
 * UNINITIALIZED → INITIALIZING → READY → PAIRING → PAIRED → DISCONNECTED.
 * INITIALIZING goes straight to PAIRED when the connector already holds a
 * saved pairing. DISCONNECTED can pair again without a new handshake.
 */
public enum WalletState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    PAIRING,
    PAIRED,
    DISCONNECTED;

    public boolean canOpenPairing() {
        return this == READY || this == DISCONNECTED;
    }
}
