package com.flagship.crypto_settlement.validation;

/**
 * Classification of a received amount against the required amount.
 */
public enum ValidationOutcome {
    /** Within the asset's tolerance band. */
    VALID,
    /** Below the lower edge of the tolerance band. */
    UNDERPAYMENT,
    /** Above the upper edge of the tolerance band. */
    OVERPAYMENT
}
