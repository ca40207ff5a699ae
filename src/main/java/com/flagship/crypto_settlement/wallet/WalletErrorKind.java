package com.flagship.crypto_settlement.wallet;

/**
 * Classified wallet-side failures.
 */
public enum WalletErrorKind {
    /** Declined in the wallet. Never retried. */
    USER_REJECTED(false, "Transaction rejected by user"),
    TOKEN_NOT_ASSOCIATED(false, "Your account is not associated with this token. Associate it in your wallet and try again."),
    INSUFFICIENT_BALANCE(false, "Insufficient balance to complete this payment. Top up your wallet and try again."),
    TRANSIENT(true, "The wallet did not respond. Please try again."),
    SESSION_NOT_ESTABLISHED(true, "Signing session not established. Please reconnect your wallet."),
    NOT_PAIRED(false, "Wallet not connected. Connect your wallet first.");

    private final boolean retryable;
    private final String userMessage;

    WalletErrorKind(boolean retryable, String userMessage) {
        this.retryable = retryable;
        this.userMessage = userMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
