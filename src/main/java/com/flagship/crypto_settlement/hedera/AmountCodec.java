package com.flagship.crypto_settlement.hedera;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Lossless conversion between human-readable token amounts and integer
 * smallest units (tinybars for HBAR, micro-units for the stablecoins).
 *
 * Conversions work on the decimal string, never on binary floating point:
 * the fraction is right-padded to {@code decimals} digits and the
 * concatenated digits are the smallest-unit value. Amounts with more
 * fraction digits than the asset supports are rejected rather than rounded.
 */
public final class AmountCodec {

    public static final int MAX_DECIMALS = 18;

    private static final Pattern AMOUNT_PATTERN = Pattern.compile("^\\d+(\\.\\d+)?$");

    private AmountCodec() {
    }

    /**
     * Converts a textual amount ("15.046618") to smallest units.
     *
     * @throws IllegalArgumentException for empty, negative, scientific-notation
     *         or over-precise input, or decimals outside 0..18
     */
    public static BigInteger toSmallestUnit(String amount, int decimals) {
        checkDecimals(decimals);
        if (amount == null) {
            throw new IllegalArgumentException("Invalid amount: null");
        }
        String trimmed = amount.trim();
        if (trimmed.isEmpty() || trimmed.indexOf('e') >= 0 || trimmed.indexOf('E') >= 0) {
            throw new IllegalArgumentException("Invalid amount: scientific notation or empty");
        }
        if (trimmed.startsWith("-")) {
            throw new IllegalArgumentException("Amount cannot be negative: " + trimmed);
        }
        if (!AMOUNT_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                "Invalid amount: expected digits with optional decimal (e.g. 12.34), got " + trimmed);
        }

        int dot = trimmed.indexOf('.');
        String whole = dot < 0 ? trimmed : trimmed.substring(0, dot);
        String fraction = dot < 0 ? "" : trimmed.substring(dot + 1);
        if (fraction.length() > decimals) {
            throw new IllegalArgumentException(String.format(
                "Amount %s has too many decimal places (max %d)", trimmed, decimals));
        }

        StringBuilder digits = new StringBuilder(whole).append(fraction);
        for (int i = fraction.length(); i < decimals; i++) {
            digits.append('0');
        }
        return new BigInteger(digits.toString());
    }

    /**
     * Validates a textual amount and returns it at {@code decimals} scale.
     */
    public static BigDecimal parseAmount(String amount, int decimals) {
        return fromSmallestUnit(toSmallestUnit(amount, decimals), decimals);
    }

    public static BigInteger toSmallestUnit(BigDecimal amount, int decimals) {
        if (amount == null) {
            throw new IllegalArgumentException("Invalid amount: null");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
        return toSmallestUnit(amount.stripTrailingZeros().toPlainString(), decimals);
    }

    /**
     * Converts a double via its shortest decimal representation, so 0.1 is
     * treated as "0.1" and not as its binary expansion.
     */
    public static BigInteger toSmallestUnit(double amount, int decimals) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new IllegalArgumentException("Amount must be a finite number");
        }
        if (amount < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
        return toSmallestUnit(BigDecimal.valueOf(amount), decimals);
    }

    /**
     * Exact inverse of {@link #toSmallestUnit(String, int)}. The result has
     * scale {@code decimals}, so 1500000 at 6 decimals is 1.500000.
     */
    public static BigDecimal fromSmallestUnit(BigInteger units, int decimals) {
        checkDecimals(decimals);
        if (units == null) {
            throw new IllegalArgumentException("Smallest unit amount must not be null");
        }
        if (units.signum() < 0) {
            throw new IllegalArgumentException("Smallest unit amount cannot be negative: " + units);
        }
        return new BigDecimal(units, decimals);
    }

    public static BigDecimal fromSmallestUnit(long units, int decimals) {
        return fromSmallestUnit(BigInteger.valueOf(units), decimals);
    }

    /**
     * Renders smallest units with exactly {@code decimals} fraction digits
     * ("0.00000000" for zero tinybars).
     */
    public static String format(BigInteger units, int decimals) {
        return fromSmallestUnit(units, decimals).toPlainString();
    }

    public static String zero(int decimals) {
        return format(BigInteger.ZERO, decimals);
    }

    private static void checkDecimals(int decimals) {
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new IllegalArgumentException("Decimals must be between 0 and " + MAX_DECIMALS);
        }
    }
}
