package com.flagship.crypto_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_settlement.hedera.HederaToken;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One bounded check for a payment into the merchant account.
 */
@Value
public class TransactionCheckRequest {

    @NotNull(message = "Invoice ID is required")
    @JsonProperty("invoice_id")
    UUID invoiceId;

    @NotBlank(message = "Merchant account ID is required")
    @Pattern(regexp = "^\\d+\\.\\d+\\.\\d+$", message = "Merchant account ID must look like 0.0.12345")
    @JsonProperty("merchant_account_id")
    String merchantAccountId;

    @NotNull(message = "Token is required")
    @JsonProperty("token")
    HederaToken token;

    @NotNull(message = "Expected amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Expected amount must be greater than 0")
    @JsonProperty("expected_amount")
    BigDecimal expectedAmount;

    @JsonProperty("payer_account_id")
    String payerAccountId;

    @JsonProperty("memo")
    String memo;

    @Min(value = 1, message = "Time window must be at least 1 minute")
    @Max(value = 1440, message = "Time window must be at most 1440 minutes")
    @JsonProperty("time_window_minutes")
    Integer timeWindowMinutes;
}
