package com.flagship.crypto_settlement.validation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Review decision for an overpayment. Up to 20% excess is accepted;
 * anything above 10% is flagged for review.
 */
@Value
public class OverpaymentGuidance {
    BigDecimal excess;
    BigDecimal excessPercent;
    boolean acceptable;
    boolean requiresReview;
    String message;
}
