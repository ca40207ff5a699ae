package com.flagship.crypto_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_settlement.matcher.InboundLeg;
import com.flagship.crypto_settlement.settlement.ConfirmationOutcome;
import com.flagship.crypto_settlement.settlement.SettlementResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionCheckResponse {

    @JsonProperty("found")
    boolean found;

    @JsonProperty("status")
    ConfirmationOutcome.Status status;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("sender")
    String sender;

    @JsonProperty("consensus_timestamp")
    String consensusTimestamp;

    @JsonProperty("memo")
    String memo;

    @JsonProperty("validation")
    String validation;

    @JsonProperty("settlement")
    SettlementResult.Outcome settlement;

    @JsonProperty("ledger_posted")
    Boolean ledgerPosted;

    @JsonProperty("transactions_checked")
    int transactionsChecked;

    @JsonProperty("message")
    String message;

    public static TransactionCheckResponse from(ConfirmationOutcome outcome) {
        TransactionCheckResponseBuilder builder = TransactionCheckResponse.builder()
            .found(outcome.isSettled())
            .status(outcome.getStatus())
            .transactionsChecked(outcome.getTransactionsChecked())
            .message(outcome.getDetail());

        InboundLeg leg = outcome.getLeg();
        if (leg != null) {
            builder.transactionId(leg.getTransactionId())
                .amount(leg.getAmount())
                .sender(leg.getSender())
                .consensusTimestamp(leg.getConsensusTimestamp())
                .memo(leg.getMemo());
        }
        if (outcome.getValidation() != null) {
            builder.validation(outcome.getValidation().getMessage());
        }
        SettlementResult settlement = outcome.getSettlement();
        if (settlement != null) {
            builder.settlement(settlement.getOutcome())
                .ledgerPosted(settlement.isLedgerPosted());
        }
        return builder.build();
    }
}
