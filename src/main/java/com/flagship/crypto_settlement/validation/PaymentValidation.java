package com.flagship.crypto_settlement.validation;

import com.flagship.crypto_settlement.hedera.HederaToken;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Verdict produced by {@link PaymentValidator}.
 *
 * Amount mismatches are outcomes, not errors: callers use the verdict for
 * matching decisions and for the guidance shown to the payer.
 */
@Value
public class PaymentValidation {
    HederaToken token;
    BigDecimal requiredAmount;
    BigDecimal receivedAmount;
    /** received - required; negative for underpayments. */
    BigDecimal difference;
    BigDecimal differencePercent;
    BigDecimal tolerancePercent;
    ValidationOutcome outcome;
    String message;

    public boolean isValid() {
        return outcome == ValidationOutcome.VALID;
    }

    public boolean isUnderpayment() {
        return outcome == ValidationOutcome.UNDERPAYMENT;
    }

    public boolean isOverpayment() {
        return outcome == ValidationOutcome.OVERPAYMENT;
    }

    /**
     * Amount still owed; zero unless this is an underpayment.
     */
    public BigDecimal getShortfall() {
        return isUnderpayment() ? difference.negate() : BigDecimal.ZERO;
    }

    /**
     * Amount paid beyond the band's reference; zero unless this is an overpayment.
     */
    public BigDecimal getExcess() {
        return isOverpayment() ? difference : BigDecimal.ZERO;
    }
}
