package com.flagship.crypto_settlement.matcher;

import com.flagship.crypto_settlement.mirror.MirrorTransaction;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one matcher check.
 *
 * "Not found" is a normal outcome. {@code error} is set when the check could
 * not complete (timeout, mirror node failure); the caller simply checks again
 * later.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MatchResult {
    boolean found;
    MirrorTransaction transaction;
    InboundLeg leg;
    int transactionsChecked;
    String error;

    public static MatchResult found(MirrorTransaction transaction, InboundLeg leg, int transactionsChecked) {
        return new MatchResult(true, transaction, leg, transactionsChecked, null);
    }

    public static MatchResult notFound(int transactionsChecked) {
        return new MatchResult(false, null, null, transactionsChecked, null);
    }

    public static MatchResult failed(String error) {
        return new MatchResult(false, null, null, 0, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
