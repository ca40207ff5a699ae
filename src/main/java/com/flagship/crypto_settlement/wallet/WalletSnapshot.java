package com.flagship.crypto_settlement.wallet;

import lombok.Value;

/**
 * Immutable view of the session handed to {@link WalletStateListener}s.
 */
@Value
public class WalletSnapshot {
    WalletState state;
    String accountId;
    String network;
    WalletBalances balances;
    String error;

    public boolean isConnected() {
        return state == WalletState.PAIRED && accountId != null;
    }
}
