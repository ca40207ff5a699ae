package com.flagship.crypto_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_settlement.hedera.HederaToken;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Confirms a transaction id reported by the payer's wallet.
 */
@Value
public class ConfirmPaymentRequest {

    @NotNull(message = "Invoice ID is required")
    @JsonProperty("invoice_id")
    UUID invoiceId;

    @NotBlank(message = "Transaction ID is required")
    @JsonProperty("transaction_id")
    String transactionId;

    @NotNull(message = "Token is required")
    @JsonProperty("token")
    HederaToken token;

    @NotBlank(message = "Merchant account ID is required")
    @Pattern(regexp = "^\\d+\\.\\d+\\.\\d+$", message = "Merchant account ID must look like 0.0.12345")
    @JsonProperty("merchant_account_id")
    String merchantAccountId;

    @NotNull(message = "Expected amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Expected amount must be greater than 0")
    @JsonProperty("expected_amount")
    BigDecimal expectedAmount;
}
