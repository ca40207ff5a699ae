package com.flagship.crypto_settlement.settlement;

import lombok.Value;

import java.util.UUID;

@Value
public class DuplicateCheck {
    boolean duplicate;
    UUID existingInvoiceId;
    String message;

    public static DuplicateCheck none() {
        return new DuplicateCheck(false, null, null);
    }

    public static DuplicateCheck found(UUID existingInvoiceId, String message) {
        return new DuplicateCheck(true, existingInvoiceId, message);
    }
}
