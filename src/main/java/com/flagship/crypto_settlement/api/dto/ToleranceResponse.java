package com.flagship.crypto_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_settlement.hedera.HederaToken;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ToleranceResponse {

    @JsonProperty("token")
    HederaToken token;

    @JsonProperty("required_amount")
    BigDecimal requiredAmount;

    @JsonProperty("min_amount")
    BigDecimal minAmount;

    @JsonProperty("max_amount")
    BigDecimal maxAmount;

    @JsonProperty("tolerance_percent")
    BigDecimal tolerancePercent;
}
