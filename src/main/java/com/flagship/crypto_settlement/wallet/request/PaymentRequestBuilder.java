package com.flagship.crypto_settlement.wallet.request;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.crypto_settlement.hedera.AmountCodec;
import com.flagship.crypto_settlement.hedera.HederaNetwork;
import com.flagship.crypto_settlement.hedera.HederaToken;
import com.flagship.crypto_settlement.hedera.TransactionIdNormalizer;
import com.flagship.crypto_settlement.mirror.AccountSnapshot;
import com.flagship.crypto_settlement.mirror.MirrorNodeClient;
import com.flagship.crypto_settlement.mirror.MirrorNodeException;
import com.flagship.crypto_settlement.wallet.WalletErrorKind;
import com.flagship.crypto_settlement.wallet.WalletException;
import com.flagship.crypto_settlement.wallet.WalletSessionManager;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Builds payer to merchant transfers and sends them to the paired wallet.
 *
 * HBAR and token payments differ only in how the legs are built; both go
 * through {@link #submit(PaymentRequest)}. Before asking the wallet, the
 * payer's token association and balance are checked against the mirror
 * node so the common refusals fail fast with a classified error. When the
 * mirror node itself is unavailable the checks are skipped and the wallet
 * has the final word.
 */
@Slf4j
public class PaymentRequestBuilder {

    private final WalletSessionManager sessionManager;
    private final MirrorNodeClient mirrorNodeClient;
    private final ObjectMapper objectMapper;
    private final TransactionIdGenerator transactionIdGenerator;
    private final Executor executor;

    public PaymentRequestBuilder(WalletSessionManager sessionManager,
                                 MirrorNodeClient mirrorNodeClient,
                                 ObjectMapper objectMapper,
                                 TransactionIdGenerator transactionIdGenerator,
                                 Executor executor) {
        this.sessionManager = sessionManager;
        this.mirrorNodeClient = mirrorNodeClient;
        this.objectMapper = objectMapper;
        this.transactionIdGenerator = transactionIdGenerator;
        this.executor = executor;
    }

    public UnsignedTransfer build(String payerAccountId, PaymentRequest request) {
        HederaToken token = request.getToken();
        long units = toUnits(request.getAmount(), token);
        String transactionId = transactionIdGenerator.generate(payerAccountId);
        HederaNetwork network = mirrorNodeClient.getNetwork();

        List<TransferLeg> legs = List.of(
            TransferLeg.debit(payerAccountId, units),
            TransferLeg.credit(request.getMerchantAccountId(), units));
        String tokenId = token.isNative() ? null : token.tokenId(network);

        log.debug("Built {} transfer: txId={}, from={}, to={}, units={}",
            token, transactionId, payerAccountId, request.getMerchantAccountId(), units);
        return new UnsignedTransfer(transactionId, network.getId(), token, tokenId, request.getMemo(), legs);
    }

    /**
     * Pre-flight checks, build, and wallet submission.
     *
     * @return fails with {@link WalletException}: NOT_PAIRED,
     *         TOKEN_NOT_ASSOCIATED, INSUFFICIENT_BALANCE, USER_REJECTED,
     *         SESSION_NOT_ESTABLISHED or TRANSIENT
     */
    public CompletableFuture<PaymentSubmission> submit(PaymentRequest request) {
        String payer = sessionManager.getAccountId().orElse(null);
        if (payer == null) {
            return CompletableFuture.failedFuture(WalletException.of(WalletErrorKind.NOT_PAIRED));
        }
        long units;
        try {
            units = toUnits(request.getAmount(), request.getToken());
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        return CompletableFuture
            .runAsync(() -> preflight(payer, request.getToken(), units), executor)
            .thenApply(ignored -> build(payer, request))
            .thenCompose(transfer -> sessionManager
                .submitTransaction(transfer.toBytes(objectMapper), payer)
                .thenApply(response -> {
                    String reported = response.transactionId()
                        .map(TransactionIdNormalizer::normalize)
                        .orElseGet(() -> TransactionIdNormalizer.normalize(transfer.getTransactionId()));
                    log.info("Payment submitted: token={}, txId={}, merchant={}",
                        request.getToken(), reported, request.getMerchantAccountId());
                    return new PaymentSubmission(reported, transfer.getMemo(), response.getShape());
                }));
    }

    void preflight(String payer, HederaToken token, long units) {
        try {
            if (!token.isNative()) {
                String tokenId = token.tokenId(mirrorNodeClient.getNetwork());
                boolean associated = mirrorNodeClient.getTokenRelationships(payer).stream()
                    .anyMatch(relationship -> tokenId.equals(relationship.getTokenId()));
                if (!associated) {
                    throw new WalletException(WalletErrorKind.TOKEN_NOT_ASSOCIATED, String.format(
                        "Account %s is not associated with %s (%s). Associate the token in your wallet and try again.",
                        payer, token, tokenId));
                }
            }

            AccountSnapshot account = mirrorNodeClient.getAccount(payer);
            BigInteger available = token.isNative()
                ? account.getTinybars()
                : account.tokenBalance(token.tokenId(mirrorNodeClient.getNetwork()));
            if (available == null || available.compareTo(BigInteger.valueOf(units)) < 0) {
                throw new WalletException(WalletErrorKind.INSUFFICIENT_BALANCE, String.format(
                    "Insufficient %s balance: required %s, available %s",
                    token,
                    AmountCodec.format(BigInteger.valueOf(units), token.getDecimals()),
                    AmountCodec.format(available == null ? BigInteger.ZERO : available, token.getDecimals())));
            }
        } catch (MirrorNodeException e) {
            log.warn("Skipping payment pre-flight checks, mirror node unavailable: {}", e.getMessage());
        }
    }

    private static long toUnits(String amount, HederaToken token) {
        BigInteger units = AmountCodec.toSmallestUnit(amount, token.getDecimals());
        if (units.signum() == 0) {
            throw new IllegalArgumentException("Payment amount must be greater than zero");
        }
        try {
            return units.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Payment amount too large: " + amount, e);
        }
    }
}
