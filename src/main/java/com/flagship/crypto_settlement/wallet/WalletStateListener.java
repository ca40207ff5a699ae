package com.flagship.crypto_settlement.wallet;

@FunctionalInterface
public interface WalletStateListener {

    void onStateChange(WalletSnapshot snapshot);
}
