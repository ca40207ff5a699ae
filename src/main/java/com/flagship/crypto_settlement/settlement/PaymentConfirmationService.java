package com.flagship.crypto_settlement.settlement;

import com.flagship.crypto_settlement.hedera.HederaToken;
import com.flagship.crypto_settlement.matcher.InboundLeg;
import com.flagship.crypto_settlement.matcher.MatchCriteria;
import com.flagship.crypto_settlement.matcher.MatchResult;
import com.flagship.crypto_settlement.matcher.TransactionMatcher;
import com.flagship.crypto_settlement.mirror.MirrorNodeClient;
import com.flagship.crypto_settlement.mirror.MirrorTransaction;
import com.flagship.crypto_settlement.validation.PaymentValidation;
import com.flagship.crypto_settlement.validation.PaymentValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Server-side entry points from detection to settlement.
 *
 * {@link #checkAndSettle} runs one bounded matcher check; {@link #confirmTransaction}
 * verifies a transaction id the wallet reported. Both validate the amount
 * before anything reaches the {@link SettlementPoster}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentConfirmationService {

    private final TransactionMatcher matcher;
    private final PaymentValidator validator;
    private final MirrorNodeClient mirrorNodeClient;
    private final SettlementPoster settlementPoster;

    public ConfirmationOutcome checkAndSettle(UUID invoiceId, MatchCriteria criteria) {
        MatchResult match = matcher.check(criteria);
        if (!match.isFound()) {
            return ConfirmationOutcome.notFound(match.getTransactionsChecked(), match.getError());
        }

        InboundLeg leg = match.getLeg();
        PaymentValidation validation = validator.validate(criteria.getExpectedAmount(), leg.getAmount(), criteria.getToken());
        SettlementResult settlement = settlementPoster.confirm(
            SettlementRequest.fromLeg(invoiceId, leg, criteria.getToken(), criteria.getMerchantAccountId()));
        return ConfirmationOutcome.settled(leg, validation, settlement, match.getTransactionsChecked());
    }

    /**
     * @throws com.flagship.crypto_settlement.mirror.MirrorNodeException if the mirror node cannot be queried
     */
    public ConfirmationOutcome confirmTransaction(UUID invoiceId, String transactionId, HederaToken token,
                                                  String merchantAccountId, BigDecimal expectedAmount) {
        log.info("Verifying transaction on mirror node: invoiceId={}, txId={}, merchant={}",
            invoiceId, transactionId, merchantAccountId);

        Optional<MirrorTransaction> found = mirrorNodeClient.getTransaction(transactionId);
        if (found.isEmpty()) {
            log.warn("Transaction not found on mirror node: txId={}", transactionId);
            return ConfirmationOutcome.notFound(0,
                "Transaction may not be confirmed yet or the transaction id is invalid");
        }

        MirrorTransaction transaction = found.get();
        if (!transaction.isConfirmed()) {
            log.warn("Transaction not yet confirmed: txId={}, result={}", transactionId, transaction.getResult());
            return ConfirmationOutcome.rejected(ConfirmationOutcome.Status.NOT_CONFIRMED, null, null,
                "Transaction result: " + transaction.getResult());
        }

        Optional<InboundLeg> leg = matcher.extractInboundLeg(transaction, merchantAccountId, token);
        if (leg.isEmpty()) {
            return ConfirmationOutcome.rejected(ConfirmationOutcome.Status.NO_TRANSFER, null, null,
                "No " + token + " transfer found to merchant account");
        }

        PaymentValidation validation = validator.validate(expectedAmount, leg.get().getAmount(), token);
        if (!validation.isValid()) {
            log.warn("Amount outside tolerance range: txId={}, {}", transactionId, validation.getMessage());
            return ConfirmationOutcome.rejected(ConfirmationOutcome.Status.AMOUNT_MISMATCH, leg.get(), validation,
                validator.formatValidationError(validation));
        }

        SettlementResult settlement = settlementPoster.confirm(
            SettlementRequest.fromLeg(invoiceId, leg.get(), token, merchantAccountId));
        return ConfirmationOutcome.settled(leg.get(), validation, settlement, 1);
    }
}
