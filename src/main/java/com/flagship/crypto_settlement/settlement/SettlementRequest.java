package com.flagship.crypto_settlement.settlement;

import com.flagship.crypto_settlement.hedera.HederaToken;
import com.flagship.crypto_settlement.matcher.InboundLeg;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A matched on-chain payment to be settled against an invoice.
 * {@code transactionId} may be in either wire format.
 */
@Value
public class SettlementRequest {
    UUID invoiceId;
    String transactionId;
    HederaToken token;
    BigDecimal amountReceived;
    String sender;
    String memo;
    String consensusTimestamp;
    String merchantAccountId;

    public static SettlementRequest fromLeg(UUID invoiceId, InboundLeg leg, HederaToken token, String merchantAccountId) {
        return new SettlementRequest(invoiceId, leg.getTransactionId(), token, leg.getAmount(),
            leg.getSender(), leg.getMemo(), leg.getConsensusTimestamp(), merchantAccountId);
    }
}
