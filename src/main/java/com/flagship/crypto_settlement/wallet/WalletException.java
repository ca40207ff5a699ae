package com.flagship.crypto_settlement.wallet;

/**
 * Wallet failure carrying its classification.
 */
public class WalletException extends RuntimeException {

    private final WalletErrorKind kind;

    public WalletException(WalletErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public WalletException(WalletErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static WalletException of(WalletErrorKind kind) {
        return new WalletException(kind, kind.getUserMessage());
    }

    public WalletErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
