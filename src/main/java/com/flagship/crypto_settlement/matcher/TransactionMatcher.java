package com.flagship.crypto_settlement.matcher;

import com.flagship.crypto_settlement.hedera.AmountCodec;
import com.flagship.crypto_settlement.hedera.HederaToken;
import com.flagship.crypto_settlement.mirror.MirrorNodeClient;
import com.flagship.crypto_settlement.mirror.MirrorTokenTransfer;
import com.flagship.crypto_settlement.mirror.MirrorTransaction;
import com.flagship.crypto_settlement.mirror.MirrorTransfer;
import com.flagship.crypto_settlement.mirror.TransactionQuery;
import com.flagship.crypto_settlement.observability.SettlementMetrics;
import com.flagship.crypto_settlement.validation.PaymentValidator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Finds the on-chain transfer that pays an invoice.
 *
 * One check is one mirror node query: the newest page of transfers into the
 * merchant account within the time window. Each candidate's inbound leg is
 * tested, in order, against
 * 1. the expected sender (when given)
 * 2. the memo, as a substring of the decoded memo (when given)
 * 3. the amount, within the token's tolerance
 * and the first candidate passing every supplied predicate is the match.
 *
 * A check is time-boxed; when the budget runs out the query is cancelled and
 * the check reports "not found" with an error. Mirror node failures are
 * reported the same way and never propagate.
 */
@Component
@Slf4j
public class TransactionMatcher {

    private final MirrorNodeClient mirrorNodeClient;
    private final PaymentValidator paymentValidator;
    private final SettlementMetrics metrics;
    private final Clock clock;
    private final long checkTimeoutMs;
    private final int pageLimit;
    private final ExecutorService checkExecutor;

    @Autowired
    public TransactionMatcher(MirrorNodeClient mirrorNodeClient,
                              PaymentValidator paymentValidator,
                              SettlementMetrics metrics,
                              @Value("${matcher.check-timeout-ms:7000}") long checkTimeoutMs,
                              @Value("${matcher.page-limit:20}") int pageLimit) {
        this(mirrorNodeClient, paymentValidator, metrics, Clock.systemUTC(), checkTimeoutMs, pageLimit);
    }

    TransactionMatcher(MirrorNodeClient mirrorNodeClient,
                       PaymentValidator paymentValidator,
                       SettlementMetrics metrics,
                       Clock clock,
                       long checkTimeoutMs,
                       int pageLimit) {
        this.mirrorNodeClient = mirrorNodeClient;
        this.paymentValidator = paymentValidator;
        this.metrics = metrics;
        this.clock = clock;
        this.checkTimeoutMs = checkTimeoutMs;
        this.pageLimit = pageLimit;
        this.checkExecutor = Executors.newCachedThreadPool(daemonThreads());
    }

    /**
     * Runs one bounded check.
     */
    public MatchResult check(MatchCriteria criteria) {
        long startTime = System.currentTimeMillis();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        Future<MatchResult> future = checkExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return scan(criteria);
            } finally {
                MDC.clear();
            }
        });

        MatchResult result;
        try {
            result = future.get(checkTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Transaction check timed out: merchant={}, timeout={}ms",
                criteria.getMerchantAccountId(), checkTimeoutMs);
            result = MatchResult.failed("Timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Failed to check for transaction: merchant={}, error={}",
                criteria.getMerchantAccountId(), cause.getMessage());
            result = MatchResult.failed(cause.getMessage() != null ? cause.getMessage() : "Unknown error");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            result = MatchResult.failed("Interrupted");
        }

        metrics.recordMatcherCheck(result.isFound() ? "found" : result.hasError() ? "error" : "not_found");
        metrics.recordLatency("matcher_check", System.currentTimeMillis() - startTime);
        return result;
    }

    /**
     * Evaluates one candidate transaction against the criteria.
     */
    public Optional<InboundLeg> match(MirrorTransaction tx, MatchCriteria criteria) {
        Optional<InboundLeg> leg = extractInboundLeg(tx, criteria.getMerchantAccountId(), criteria.getToken());
        if (leg.isEmpty()) {
            return Optional.empty();
        }
        InboundLeg inbound = leg.get();

        if (criteria.getExpectedSender() != null && !criteria.getExpectedSender().equals(inbound.getSender())) {
            log.debug("Transaction payer mismatch: txId={}, expected={}, actual={}",
                tx.getTransactionId(), criteria.getExpectedSender(), inbound.getSender());
            return Optional.empty();
        }

        if (criteria.getMemo() != null && !inbound.getMemo().contains(criteria.getMemo())) {
            log.debug("Transaction memo mismatch: txId={}, expected={}, actual={}",
                tx.getTransactionId(), criteria.getMemo(), inbound.getMemo());
            return Optional.empty();
        }

        if (!paymentValidator.isWithinTolerance(criteria.getExpectedAmount(), inbound.getAmount(), criteria.getToken())) {
            log.debug("Transaction amount mismatch: txId={}, expected={}, actual={}",
                tx.getTransactionId(), criteria.getExpectedAmount(), inbound.getAmount());
            return Optional.empty();
        }

        return leg;
    }

    /**
     * Pulls the merchant's credit out of a transaction.
     *
     * HBAR: the positive transfer to the merchant; the sender is the first
     * debited account. Tokens: the positive transfer of the token to the
     * merchant; the sender is the first account debited that token.
     */
    public Optional<InboundLeg> extractInboundLeg(MirrorTransaction tx, String merchantAccountId, HederaToken token) {
        BigInteger units;
        String sender;

        if (token.isNative()) {
            Optional<MirrorTransfer> credit = tx.getTransfers().stream()
                .filter(t -> merchantAccountId.equals(t.getAccount()) && t.getAmount() > 0)
                .findFirst();
            if (credit.isEmpty()) {
                return Optional.empty();
            }
            units = BigInteger.valueOf(credit.get().getAmount());
            sender = tx.getTransfers().stream()
                .filter(t -> t.getAmount() < 0)
                .map(MirrorTransfer::getAccount)
                .findFirst()
                .orElse(InboundLeg.UNKNOWN_SENDER);
        } else {
            String tokenId = token.tokenId(mirrorNodeClient.getNetwork());
            Optional<MirrorTokenTransfer> credit = tx.getTokenTransfers().stream()
                .filter(t -> tokenId.equals(t.getTokenId())
                    && merchantAccountId.equals(t.getAccount())
                    && t.getAmount() > 0)
                .findFirst();
            if (credit.isEmpty()) {
                return Optional.empty();
            }
            units = BigInteger.valueOf(credit.get().getAmount());
            sender = tx.getTokenTransfers().stream()
                .filter(t -> tokenId.equals(t.getTokenId()) && t.getAmount() < 0)
                .map(MirrorTokenTransfer::getAccount)
                .findFirst()
                .orElse(InboundLeg.UNKNOWN_SENDER);
        }

        return Optional.of(new InboundLeg(
            tx.getTransactionId(),
            units,
            AmountCodec.fromSmallestUnit(units, token.getDecimals()),
            sender,
            tx.getConsensusTimestamp(),
            tx.decodedMemo()));
    }

    private MatchResult scan(MatchCriteria criteria) {
        Instant since = clock.instant().minus(criteria.getTimeWindow());
        TransactionQuery query = new TransactionQuery(
            criteria.getMerchantAccountId(), pageLimit, since, criteria.getToken().transactionTypeFilter());

        List<MirrorTransaction> transactions = mirrorNodeClient.findTransactions(query);
        log.info("Mirror node page received: merchant={}, token={}, transactions={}",
            criteria.getMerchantAccountId(), criteria.getToken(), transactions.size());

        for (MirrorTransaction tx : transactions) {
            Optional<InboundLeg> leg = match(tx, criteria);
            if (leg.isPresent()) {
                log.info("Matching transaction found: txId={}, amount={}, sender={}",
                    tx.getTransactionId(), leg.get().getAmount(), leg.get().getSender());
                return MatchResult.found(tx, leg.get(), transactions.size());
            }
        }

        log.info("No matching transaction found: merchant={}, transactionsChecked={}",
            criteria.getMerchantAccountId(), transactions.size());
        return MatchResult.notFound(transactions.size());
    }

    @PreDestroy
    void shutdown() {
        checkExecutor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "matcher-check-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
