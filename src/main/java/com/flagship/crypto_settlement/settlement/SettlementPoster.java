package com.flagship.crypto_settlement.settlement;

import com.flagship.crypto_settlement.hedera.HederaToken;
import com.flagship.crypto_settlement.hedera.TransactionIdNormalizer;
import com.flagship.crypto_settlement.invoice.Invoice;
import com.flagship.crypto_settlement.invoice.InvoiceStatus;
import com.flagship.crypto_settlement.invoice.InvoiceStore;
import com.flagship.crypto_settlement.ledger.BalanceCheck;
import com.flagship.crypto_settlement.ledger.LedgerAccountService;
import com.flagship.crypto_settlement.ledger.LedgerService;
import com.flagship.crypto_settlement.ledger.PostingRequest;
import com.flagship.crypto_settlement.ledger.PostingResult;
import com.flagship.crypto_settlement.ledger.SettlementAccounts;
import com.flagship.crypto_settlement.mirror.MirrorNodeClient;
import com.flagship.crypto_settlement.observability.RequestIdContext;
import com.flagship.crypto_settlement.observability.SettlementMetrics;
import com.flagship.crypto_settlement.outbox.LedgerSyncQueue;
import com.flagship.crypto_settlement.settlement.lock.InvoiceLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records a matched on-chain payment exactly once.
 *
 * Order of operations:
 * 1. Duplicate check by correlation id and by every transaction id spelling
 * 2. Invoice status check (PAID, CANCELED, EXPIRED are rejected)
 * 3. Non-blocking per-invoice lock; contention fails fast
 * 4. Under the lock: duplicate re-check, then one transaction that marks the
 *    invoice PAID and appends the PAYMENT_CONFIRMED event
 * 5. A second transaction that provisions the accounts and writes one DEBIT
 *    and one CREDIT, then checks the invoice balances
 * 6. Ledger sync job enqueued
 *
 * Steps 4 and 5 run in separate transactions: a confirmed transfer keeps the
 * invoice PAID even if the ledger write fails. That failure is logged and
 * reported with {@code ledgerPosted == false}; {@link #retryLedgerPosting(UUID)}
 * repairs it under the same lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementPoster {

    private final DuplicatePaymentDetector duplicateDetector;
    private final PaymentAttemptValidator attemptValidator;
    private final InvoiceLock invoiceLock;
    private final InvoiceStore invoiceStore;
    private final PaymentEventStore paymentEventStore;
    private final LedgerAccountService ledgerAccountService;
    private final LedgerService ledgerService;
    private final HederaPostingRule postingRule;
    private final LedgerSyncQueue ledgerSyncQueue;
    private final MirrorNodeClient mirrorNodeClient;
    private final TransactionTemplate transactionTemplate;
    private final SettlementMetrics metrics;

    /**
     * @throws PaymentAttemptRejectedException if the invoice cannot accept a payment
     * @throws SettlementInProgressException if another request holds the invoice lock
     */
    public SettlementResult confirm(SettlementRequest request) {
        long startTime = System.currentTimeMillis();
        UUID invoiceId = request.getInvoiceId();
        String normalizedTxId = TransactionIdNormalizer.normalize(request.getTransactionId());
        String correlationId = CorrelationIds.forHederaTransaction(request.getTransactionId());

        MDC.put(RequestIdContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        MDC.put(RequestIdContext.CORRELATION_ID_MDC_KEY, correlationId);
        try {
            log.info("Processing Hedera payment confirmation: txId={}, token={}, amountReceived={}",
                normalizedTxId, request.getToken(), request.getAmountReceived());

            DuplicateCheck duplicate = duplicateDetector.check(correlationId, request.getTransactionId());
            if (duplicate.isDuplicate()) {
                log.warn("Duplicate payment detected - skipping: txId={}", normalizedTxId);
                metrics.incrementDuplicates();
                return SettlementResult.duplicate(invoiceId, correlationId, normalizedTxId);
            }

            AttemptValidation validation = attemptValidator.validate(invoiceId);
            if (!validation.isAllowed()) {
                log.warn("Payment attempt not allowed: reason={}, status={}",
                    validation.getReason(), validation.getCurrentStatus());
                metrics.recordSettlement(request.getToken().name(), "rejected");
                throw new PaymentAttemptRejectedException(invoiceId, validation);
            }

            if (!invoiceLock.tryAcquire(invoiceId)) {
                log.warn("Could not acquire payment lock - another request may be handling it");
                metrics.incrementLockContention();
                throw new SettlementInProgressException(invoiceId);
            }

            try {
                return settleLocked(request, normalizedTxId, correlationId);
            } finally {
                invoiceLock.release(invoiceId);
            }
        } finally {
            metrics.recordSettlementDuration(Duration.ofMillis(System.currentTimeMillis() - startTime));
            MDC.remove(RequestIdContext.INVOICE_ID_MDC_KEY);
            MDC.remove(RequestIdContext.CORRELATION_ID_MDC_KEY);
        }
    }

    /**
     * Writes the ledger entries for a confirmed invoice that has none.
     *
     * @throws SettlementInProgressException if a settlement for the invoice is running
     * @throws IllegalStateException if the invoice is not PAID, has no confirmation event, or posting fails again
     */
    public LedgerRetryResult retryLedgerPosting(UUID invoiceId) {
        MDC.put(RequestIdContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        try {
            log.info("Retrying ledger posting");
            if (!invoiceLock.tryAcquire(invoiceId)) {
                metrics.incrementLockContention();
                throw new SettlementInProgressException(invoiceId);
            }
            try {
                return retryLocked(invoiceId);
            } finally {
                invoiceLock.release(invoiceId);
            }
        } finally {
            MDC.remove(RequestIdContext.INVOICE_ID_MDC_KEY);
            MDC.remove(RequestIdContext.CORRELATION_ID_MDC_KEY);
        }
    }

    public boolean hasLedgerEntries(UUID invoiceId) {
        return ledgerService.hasEntriesForInvoice(invoiceId);
    }

    /**
     * Confirms each request independently; one failure never stops the batch.
     */
    public List<BatchConfirmResult> batchConfirm(List<SettlementRequest> requests) {
        List<BatchConfirmResult> results = new ArrayList<>(requests.size());
        for (SettlementRequest request : requests) {
            try {
                results.add(new BatchConfirmResult(request.getInvoiceId(), true, confirm(request), null));
            } catch (RuntimeException e) {
                log.warn("Batch confirmation failed for invoice {}: {}", request.getInvoiceId(), e.getMessage());
                results.add(new BatchConfirmResult(request.getInvoiceId(), false, null, e.getMessage()));
            }
        }
        log.info("Batch confirmation finished: total={}, succeeded={}",
            results.size(), results.stream().filter(BatchConfirmResult::isSuccess).count());
        return results;
    }

    private SettlementResult settleLocked(SettlementRequest request, String normalizedTxId, String correlationId) {
        UUID invoiceId = request.getInvoiceId();

        if (duplicateDetector.check(correlationId, request.getTransactionId()).isDuplicate()) {
            log.info("Payment recorded by a concurrent request - skipping: txId={}", normalizedTxId);
            metrics.incrementDuplicates();
            return SettlementResult.duplicate(invoiceId, correlationId, normalizedTxId);
        }

        Invoice paid;
        try {
            paid = transactionTemplate.execute(status -> {
                Invoice current = invoiceStore.findById(invoiceId)
                    .orElseThrow(() -> new IllegalArgumentException("Invoice not found: " + invoiceId));
                if (current.getStatus() == InvoiceStatus.PAID) {
                    return null;
                }
                Invoice updated = invoiceStore.markPaid(invoiceId);
                paymentEventStore.append(PaymentEvent.confirmed(
                    invoiceId,
                    normalizedTxId,
                    request.getAmountReceived(),
                    request.getToken().name(),
                    correlationId,
                    captureMetadata(request, normalizedTxId)));
                return updated;
            });
        } catch (DataIntegrityViolationException e) {
            log.warn("Payment event rejected by unique constraint, treating as duplicate: txId={}", normalizedTxId);
            metrics.incrementDuplicates();
            return SettlementResult.duplicate(invoiceId, correlationId, normalizedTxId);
        }

        if (paid == null) {
            log.info("Invoice already marked as PAID");
            return SettlementResult.alreadyPaid(invoiceId, correlationId, normalizedTxId);
        }
        duplicateDetector.remember(correlationId, invoiceId);
        log.info("Invoice updated to PAID status: txId={}, token={}", normalizedTxId, request.getToken());

        LedgerPosting posting = postLedger(paid, request.getToken(), normalizedTxId, correlationId);
        boolean syncQueued = posting.isPosted() && enqueueSync(paid, correlationId);

        metrics.recordSettlement(request.getToken().name(), posting.isPosted() ? "confirmed" : "ledger_failed");
        return SettlementResult.confirmed(invoiceId, correlationId, normalizedTxId, posting, syncQueued);
    }

    private LedgerRetryResult retryLocked(UUID invoiceId) {
        if (ledgerService.hasEntriesForInvoice(invoiceId)) {
            log.info("Ledger entries already exist");
            return new LedgerRetryResult(invoiceId, LedgerRetryResult.Status.ALREADY_POSTED, null, false);
        }

        Invoice invoice = invoiceStore.findById(invoiceId)
            .orElseThrow(() -> new IllegalArgumentException("Invoice not found: " + invoiceId));
        if (invoice.getStatus() != InvoiceStatus.PAID) {
            throw new IllegalStateException(String.format(
                "Cannot post ledger entries for invoice %s in %s status", invoiceId, invoice.getStatus()));
        }
        PaymentEvent event = paymentEventStore.findConfirmation(invoiceId)
            .orElseThrow(() -> new IllegalStateException("No confirmed payment event for invoice " + invoiceId));
        MDC.put(RequestIdContext.CORRELATION_ID_MDC_KEY, event.getCorrelationId());

        HederaToken token = HederaToken.valueOf(event.getCurrencyReceived());
        LedgerPosting posting = postLedger(invoice, token, event.getHederaTransactionId(), event.getCorrelationId());
        if (!posting.isPosted()) {
            throw new IllegalStateException("Ledger posting retry failed: " + posting.getError());
        }
        boolean syncQueued = enqueueSync(invoice, event.getCorrelationId());
        log.info("Ledger posting retry succeeded");
        return new LedgerRetryResult(invoiceId, LedgerRetryResult.Status.POSTED, event.getCorrelationId(), syncQueued);
    }

    private LedgerPosting postLedger(Invoice invoice, HederaToken token, String normalizedTxId, String correlationId) {
        try {
            PostingResult result = transactionTemplate.execute(status -> {
                SettlementAccounts accounts = ledgerAccountService.ensureSettlementAccounts(
                    invoice.getOrganizationId(), token);
                PostingRequest posting = postingRule.build(invoice, token, normalizedTxId, correlationId, accounts);
                PostingResult posted = ledgerService.post(posting);

                BalanceCheck balance = ledgerService.validateInvoiceBalance(invoice.getId());
                if (!balance.isBalanced()) {
                    throw new IllegalStateException(String.format(
                        "Ledger unbalanced for invoice %s: debits=%s, credits=%s",
                        invoice.getId(), balance.getDebitTotal(), balance.getCreditTotal()));
                }
                return posted;
            });
            log.info("Hedera settlement posted to ledger: invoiceAmount={}, currency={}, alreadyPosted={}",
                invoice.getAmount(), invoice.getCurrency(), result.isAlreadyPosted());
            return LedgerPosting.posted(result.isAlreadyPosted());
        } catch (RuntimeException e) {
            log.error("Failed to post Hedera settlement to ledger, payment remains confirmed: txId={}, error={}",
                normalizedTxId, e.getMessage(), e);
            metrics.incrementLedgerFailures();
            return LedgerPosting.failed(e.getMessage());
        }
    }

    private boolean enqueueSync(Invoice invoice, String correlationId) {
        try {
            ledgerSyncQueue.enqueue(invoice.getId(), invoice.getOrganizationId(), correlationId);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to queue ledger sync - will retry later: error={}", e.getMessage());
            return false;
        }
    }

    private Map<String, Object> captureMetadata(SettlementRequest request, String normalizedTxId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("raw_transaction_id", request.getTransactionId());
        metadata.put("normalized_transaction_id", normalizedTxId);
        metadata.put("amount", request.getAmountReceived().toPlainString());
        metadata.put("tokenType", request.getToken().name());
        metadata.put("sender", request.getSender());
        metadata.put("payer_account_id", request.getSender());
        metadata.put("consensus_timestamp", request.getConsensusTimestamp());
        metadata.put("memo", request.getMemo());
        metadata.put("merchantAccount", request.getMerchantAccountId());
        metadata.put("network", mirrorNodeClient.getNetwork().getId());
        metadata.put("mirror_url", mirrorNodeClient.getBaseUrl());
        return metadata;
    }
}
