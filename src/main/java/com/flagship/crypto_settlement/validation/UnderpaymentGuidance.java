package com.flagship.crypto_settlement.validation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * What the payer (or support) should do about a short payment.
 */
@Value
public class UnderpaymentGuidance {

    public enum SuggestedAction {
        /** Under 1% short: most likely fees or rounding. */
        MANUAL_REVIEW,
        /** 1% to 10% short: the payer can top up. */
        RETRY,
        CONTACT_SUPPORT
    }

    BigDecimal shortfall;
    BigDecimal shortfallPercent;
    SuggestedAction suggestedAction;
    String message;
}
