package com.flagship.crypto_settlement.settlement;

public enum PaymentEventType {
    PAYMENT_CONFIRMED
}
