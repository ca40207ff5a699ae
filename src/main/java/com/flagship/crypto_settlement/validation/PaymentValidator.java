package com.flagship.crypto_settlement.validation;

import com.flagship.crypto_settlement.hedera.HederaToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decides whether a received amount settles a required amount.
 *
 * The band is {@code required * (1 - tolerance)} to {@code required * (1 + tolerance)}
 * with the tolerance taken from {@link HederaToken}: 0.5% for HBAR, 0.1% for
 * the stablecoins. There is no global tolerance.
 *
 * All arithmetic is BigDecimal; the class holds no state.
 */
@Component
@Slf4j
public class PaymentValidator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal ONE_PERCENT = BigDecimal.ONE;
    private static final BigDecimal TEN_PERCENT = BigDecimal.TEN;
    private static final BigDecimal TWENTY_PERCENT = new BigDecimal("20");
    private static final int PERCENT_SCALE = 4;

    public PaymentValidation validate(BigDecimal required, BigDecimal received, HederaToken token) {
        checkAmounts(required, received, token);

        AcceptableRange range = acceptableRange(required, token);
        BigDecimal difference = received.subtract(required);
        BigDecimal differencePercent = percentOf(difference, required);

        ValidationOutcome outcome;
        String message;
        if (received.compareTo(range.getMin()) < 0) {
            outcome = ValidationOutcome.UNDERPAYMENT;
            message = String.format("Underpayment: Received %s %s, required %s %s, short by %s %s (tolerance: %s%%)",
                display(received, token), token, display(required, token), token,
                display(difference.negate(), token), token, range.getTolerancePercent().toPlainString());
        } else if (received.compareTo(range.getMax()) > 0) {
            outcome = ValidationOutcome.OVERPAYMENT;
            message = String.format("Overpayment: Received %s %s, required %s %s (+%s%% over tolerance)",
                display(received, token), token, display(required, token), token,
                differencePercent.setScale(2, RoundingMode.HALF_UP).toPlainString());
        } else {
            outcome = ValidationOutcome.VALID;
            message = String.format("Valid payment: %s %s", display(received, token), token);
        }

        PaymentValidation validation = new PaymentValidation(token, required, received, difference,
            differencePercent, range.getTolerancePercent(), outcome, message);

        log.info("Payment validation completed: token={}, required={}, received={}, outcome={}",
            token, required, received, outcome);

        return validation;
    }

    public AcceptableRange acceptableRange(BigDecimal required, HederaToken token) {
        BigDecimal tolerance = token.getTolerance();
        return new AcceptableRange(
            required.multiply(BigDecimal.ONE.subtract(tolerance)),
            required.multiply(BigDecimal.ONE.add(tolerance)),
            tolerance.multiply(HUNDRED).stripTrailingZeros());
    }

    public boolean isWithinTolerance(BigDecimal required, BigDecimal received, HederaToken token) {
        checkAmounts(required, received, token);
        return acceptableRange(required, token).contains(received);
    }

    /**
     * Short message for the payer describing the verdict.
     */
    public String formatValidationError(PaymentValidation validation) {
        return switch (validation.getOutcome()) {
            case VALID -> "Payment validated successfully";
            case UNDERPAYMENT -> String.format(
                "Payment incomplete: Missing %s %s. Please send the remaining amount.",
                display(validation.getShortfall(), validation.getToken()), validation.getToken());
            case OVERPAYMENT -> String.format(
                "Payment received exceeds requested amount by %s%%. "
                    + "The excess will be accepted but may be subject to review.",
                validation.getDifferencePercent().abs().setScale(2, RoundingMode.HALF_UP).toPlainString());
        };
    }

    /**
     * Step-by-step top-up instructions; empty unless the payment was short.
     */
    public String retryInstructions(PaymentValidation validation, String merchantAccountId) {
        if (!validation.isUnderpayment()) {
            return "";
        }
        return String.format("To complete this payment:%n%n"
                + "1. Send an additional %s %s%n"
                + "2. To the same account: %s%n"
                + "3. Include the same memo if provided%n%n"
                + "The system will automatically detect and validate your payment.",
            display(validation.getShortfall(), validation.getToken()), validation.getToken(), merchantAccountId);
    }

    public UnderpaymentGuidance underpaymentGuidance(PaymentValidation validation) {
        if (!validation.isUnderpayment()) {
            throw new IllegalArgumentException("Not an underpayment: " + validation.getOutcome());
        }
        BigDecimal shortfall = validation.getShortfall();
        BigDecimal shortfallPercent = percentOf(shortfall, validation.getRequiredAmount());
        HederaToken token = validation.getToken();

        if (shortfallPercent.compareTo(ONE_PERCENT) < 0) {
            return new UnderpaymentGuidance(shortfall, shortfallPercent,
                UnderpaymentGuidance.SuggestedAction.MANUAL_REVIEW,
                String.format("Payment was %s%% short. This will be reviewed manually.",
                    shortfallPercent.toPlainString()));
        }
        if (shortfallPercent.compareTo(TEN_PERCENT) < 0) {
            return new UnderpaymentGuidance(shortfall, shortfallPercent,
                UnderpaymentGuidance.SuggestedAction.RETRY,
                String.format("Payment was %s%% short. Please send an additional %s %s.",
                    shortfallPercent.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                    display(shortfall, token), token));
        }
        return new UnderpaymentGuidance(shortfall, shortfallPercent,
            UnderpaymentGuidance.SuggestedAction.CONTACT_SUPPORT,
            String.format("Payment was significantly short (%s%%). Please contact support for assistance.",
                shortfallPercent.setScale(2, RoundingMode.HALF_UP).toPlainString()));
    }

    public OverpaymentGuidance overpaymentGuidance(PaymentValidation validation) {
        if (!validation.isOverpayment()) {
            throw new IllegalArgumentException("Not an overpayment: " + validation.getOutcome());
        }
        BigDecimal excess = validation.getExcess();
        BigDecimal excessPercent = percentOf(excess, validation.getRequiredAmount());
        boolean requiresReview = excessPercent.compareTo(TEN_PERCENT) > 0;
        boolean acceptable = excessPercent.compareTo(TWENTY_PERCENT) <= 0;
        String percent = excessPercent.setScale(2, RoundingMode.HALF_UP).toPlainString();

        String message;
        if (!requiresReview) {
            message = String.format("Payment received with %s%% excess. This has been accepted "
                + "and will be processed normally.", percent);
        } else if (acceptable) {
            message = String.format("Payment received with %s%% excess. This requires manual review "
                + "but will be processed.", percent);
        } else {
            message = String.format("Payment received with %s%% excess. This is unusual and requires "
                + "manual investigation.", percent);
        }
        return new OverpaymentGuidance(excess, excessPercent, acceptable, requiresReview, message);
    }

    private static void checkAmounts(BigDecimal required, BigDecimal received, HederaToken token) {
        if (token == null) {
            throw new IllegalArgumentException("Token must not be null");
        }
        if (required == null || required.signum() <= 0) {
            throw new IllegalArgumentException("Required amount must be positive: " + required);
        }
        if (received == null || received.signum() < 0) {
            throw new IllegalArgumentException("Received amount cannot be negative: " + received);
        }
    }

    private static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        return part.multiply(HUNDRED).divide(whole, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    private static String display(BigDecimal amount, HederaToken token) {
        return amount.setScale(Math.max(amount.scale(), token.getDecimals()), RoundingMode.HALF_UP)
            .toPlainString();
    }
}
