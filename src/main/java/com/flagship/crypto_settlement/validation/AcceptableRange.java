package com.flagship.crypto_settlement.validation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Inclusive band of amounts accepted for a required amount.
 */
@Value
public class AcceptableRange {
    BigDecimal min;
    BigDecimal max;
    BigDecimal tolerancePercent;

    public boolean contains(BigDecimal amount) {
        return amount.compareTo(min) >= 0 && amount.compareTo(max) <= 0;
    }
}
