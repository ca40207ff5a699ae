package com.flagship.crypto_settlement.matcher;

import com.flagship.crypto_settlement.hedera.HederaToken;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * What a payment for one invoice is expected to look like on-chain.
 *
 * {@code expectedSender} and {@code memo} are optional; when null they do
 * not constrain the match.
 */
@Value
public class MatchCriteria {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(15);

    String merchantAccountId;
    HederaToken token;
    BigDecimal expectedAmount;
    String expectedSender;
    String memo;
    Duration timeWindow;

    public static MatchCriteria of(String merchantAccountId, HederaToken token, BigDecimal expectedAmount,
                                   String expectedSender, String memo, Duration timeWindow) {
        if (merchantAccountId == null || merchantAccountId.isBlank()) {
            throw new IllegalArgumentException("Merchant account id is required");
        }
        if (token == null) {
            throw new IllegalArgumentException("Token is required");
        }
        if (expectedAmount == null || expectedAmount.signum() <= 0) {
            throw new IllegalArgumentException("Expected amount must be positive");
        }
        return new MatchCriteria(merchantAccountId, token, expectedAmount,
            blankToNull(expectedSender), blankToNull(memo),
            timeWindow == null ? DEFAULT_WINDOW : timeWindow);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
