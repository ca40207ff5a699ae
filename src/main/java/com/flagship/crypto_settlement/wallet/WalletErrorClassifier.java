package com.flagship.crypto_settlement.wallet;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw wallet and network failures onto {@link WalletErrorKind}.
 *
 * Matching is on the lower-cased message of the root cause. Anything
 * unrecognised is TRANSIENT.
 */
public final class WalletErrorClassifier {

    private static final List<String> REJECTION_MARKERS =
        List.of("reject", "cancel", "denied", "user declined");
    private static final List<String> ASSOCIATION_MARKERS =
        List.of("token_not_associated", "not associated");
    private static final List<String> BALANCE_MARKERS =
        List.of("insufficient_account_balance", "insufficient_token_balance",
            "insufficient_payer_balance", "insufficient balance");
    private static final List<String> URI_MISSING_MARKERS =
        List.of("uri missing", "uri is missing", "missing uri");

    private WalletErrorClassifier() {
    }

    public static WalletErrorKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof WalletException) {
            return ((WalletException) cause).getKind();
        }
        if (cause instanceof TimeoutException) {
            return WalletErrorKind.TRANSIENT;
        }
        String message = message(cause);
        if (containsAny(message, REJECTION_MARKERS)) {
            return WalletErrorKind.USER_REJECTED;
        }
        if (containsAny(message, ASSOCIATION_MARKERS)) {
            return WalletErrorKind.TOKEN_NOT_ASSOCIATED;
        }
        if (containsAny(message, BALANCE_MARKERS)) {
            return WalletErrorKind.INSUFFICIENT_BALANCE;
        }
        return WalletErrorKind.TRANSIENT;
    }

    /**
     * The pairing prompt was opened before the wallet extension published
     * its connection URI.
     */
    public static boolean isUriMissing(Throwable error) {
        return containsAny(message(unwrap(error)), URI_MISSING_MARKERS);
    }

    /**
     * Wraps a raw failure as a classified {@link WalletException}. Already
     * classified exceptions pass through unchanged.
     */
    public static WalletException toWalletException(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof WalletException) {
            return (WalletException) cause;
        }
        WalletErrorKind kind = classify(cause);
        String detail = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        String message = kind == WalletErrorKind.TRANSIENT && !(cause instanceof TimeoutException)
            ? "Transaction failed: " + detail
            : kind.getUserMessage();
        return new WalletException(kind, message, cause);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String message(Throwable error) {
        String message = error == null ? null : error.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String message, List<String> markers) {
        return markers.stream().anyMatch(message::contains);
    }
}
