package com.flagship.crypto_settlement.hedera;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes Hedera transaction ids.
 *
 * Wallets and the SDK report {@code 0.0.5363033@1769582713.055549545}; the
 * mirror node reports {@code 0.0.5363033-1769582713-055549545}. The dash form
 * is the storage format and the input to correlation ids, so every id must
 * pass through {@link #normalize(String)} before it is stored or looked up.
 *
 * Unrecognized ids are returned unchanged (with a warning) so a malformed id
 * never breaks the settlement pipeline.
 */
@Slf4j
public final class TransactionIdNormalizer {

    private static final Pattern DASH_FORMAT = Pattern.compile("^0\\.0\\.\\d+-\\d+-\\d+$");
    private static final Pattern AT_FORMAT = Pattern.compile("^(0\\.0\\.\\d+)@(\\d+)\\.(\\d+)$");
    private static final Pattern DASH_PARTS = Pattern.compile("^(0\\.0\\.\\d+)-(\\d+)-(\\d+)$");
    private static final int NANOS_DIGITS = 9;

    private TransactionIdNormalizer() {
    }

    public static String normalize(String transactionId) {
        if (transactionId == null) {
            return null;
        }
        if (DASH_FORMAT.matcher(transactionId).matches()) {
            return transactionId;
        }

        Matcher matcher = AT_FORMAT.matcher(transactionId);
        if (!matcher.matches()) {
            log.warn("Unable to parse transaction id format, leaving unchanged: txId={}", transactionId);
            return transactionId;
        }

        return matcher.group(1) + "-" + matcher.group(2) + "-" + padNanos(matcher.group(3));
    }

    public static boolean isNormalizedFormat(String transactionId) {
        return transactionId != null && DASH_FORMAT.matcher(transactionId).matches();
    }

    /**
     * Converts to the wallet/SDK form ({@code account@seconds.nanos}).
     * Ids in neither format are returned unchanged.
     */
    public static String toAtFormat(String transactionId) {
        if (transactionId == null) {
            return null;
        }
        Matcher at = AT_FORMAT.matcher(transactionId);
        if (at.matches()) {
            return at.group(1) + "@" + at.group(2) + "." + padNanos(at.group(3));
        }
        Matcher dash = DASH_PARTS.matcher(transactionId);
        if (!dash.matches()) {
            return transactionId;
        }
        return dash.group(1) + "@" + dash.group(2) + "." + padNanos(dash.group(3));
    }

    private static String padNanos(String nanos) {
        if (nanos.length() >= NANOS_DIGITS) {
            return nanos;
        }
        return "0".repeat(NANOS_DIGITS - nanos.length()) + nanos;
    }
}
