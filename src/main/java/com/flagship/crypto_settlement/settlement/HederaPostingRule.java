package com.flagship.crypto_settlement.settlement;

import com.flagship.crypto_settlement.hedera.HederaToken;
import com.flagship.crypto_settlement.invoice.Invoice;
import com.flagship.crypto_settlement.ledger.LedgerAccountCodes;
import com.flagship.crypto_settlement.ledger.PostingRequest;
import com.flagship.crypto_settlement.ledger.SettlementAccounts;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Double-entry rule for a Hedera payment:
 * DR Crypto Clearing (token specific), CR Accounts Receivable (1200).
 *
 * Amounts are the invoice amount in the invoice currency, not the crypto
 * amount received.
 */
@Component
public class HederaPostingRule {

    public PostingRequest build(Invoice invoice, HederaToken token, String normalizedTransactionId,
                                String correlationId, SettlementAccounts accounts) {
        String clearingCode = accounts.getClearing().getCode();
        if (!LedgerAccountCodes.clearingCode(token).equals(clearingCode)) {
            throw new IllegalStateException(String.format(
                "Wrong clearing account for %s: expected %s, got %s",
                token, LedgerAccountCodes.clearingCode(token), clearingCode));
        }

        String description = token.name() + " payment received - " + normalizedTransactionId;

        return new PostingRequest(
            invoice.getId(),
            correlationId,
            description,
            invoice.getCurrency().name(),
            List.of(PostingRequest.Line.of(
                accounts.getClearing().getId(),
                invoice.getAmount(),
                CorrelationIds.debitKey(correlationId),
                description)),
            List.of(PostingRequest.Line.of(
                accounts.getReceivable().getId(),
                invoice.getAmount(),
                CorrelationIds.creditKey(correlationId),
                description))
        );
    }
}
