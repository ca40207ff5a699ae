package com.flagship.crypto_settlement.matcher;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Background polling loop for batch and unattended detection.
 *
 * Repeats {@link TransactionMatcher#check(MatchCriteria)} at a fixed interval
 * until a match, the attempt limit, or the overall timeout. Interruption is
 * honoured between attempts and ends the run with status INTERRUPTED.
 */
@Component
@Slf4j
public class PaymentMonitor {

    private final TransactionMatcher matcher;
    private final long pollIntervalMs;
    private final int maxAttempts;
    private final long timeoutMs;

    @Autowired
    public PaymentMonitor(TransactionMatcher matcher,
                          @Value("${monitor.poll-interval-ms:5000}") long pollIntervalMs,
                          @Value("${monitor.max-attempts:60}") int maxAttempts,
                          @Value("${monitor.timeout-ms:300000}") long timeoutMs) {
        this.matcher = matcher;
        this.pollIntervalMs = pollIntervalMs;
        this.maxAttempts = maxAttempts;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Polls on the calling thread until the run ends.
     */
    public MonitorResult monitor(MatchCriteria criteria) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        MatchResult last = MatchResult.notFound(0);
        int attempts = 0;

        log.info("Starting payment monitor: merchant={}, token={}, expectedAmount={}, maxAttempts={}",
            criteria.getMerchantAccountId(), criteria.getToken(), criteria.getExpectedAmount(), maxAttempts);

        while (attempts < maxAttempts && System.currentTimeMillis() < deadline) {
            if (Thread.currentThread().isInterrupted()) {
                return interrupted(last, attempts);
            }

            attempts++;
            last = matcher.check(criteria);
            if (last.isFound()) {
                log.info("Payment monitor matched transaction: txId={}, attempts={}",
                    last.getLeg().getTransactionId(), attempts);
                return new MonitorResult(MonitorResult.Status.FOUND, last, attempts);
            }
            if (last.hasError()) {
                log.debug("Monitor attempt {} failed, will retry: {}", attempts, last.getError());
            }

            if (attempts < maxAttempts) {
                try {
                    Thread.sleep(pollIntervalMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return interrupted(last, attempts);
                }
            }
        }

        log.warn("Payment monitor exhausted: merchant={}, attempts={}", criteria.getMerchantAccountId(), attempts);
        return new MonitorResult(MonitorResult.Status.EXHAUSTED, last, attempts);
    }

    public CompletableFuture<MonitorResult> monitorAsync(MatchCriteria criteria) {
        return monitorAsync(criteria, ForkJoinPool.commonPool());
    }

    public CompletableFuture<MonitorResult> monitorAsync(MatchCriteria criteria, Executor executor) {
        return CompletableFuture.supplyAsync(() -> monitor(criteria), executor);
    }

    private MonitorResult interrupted(MatchResult last, int attempts) {
        log.info("Payment monitor interrupted after {} attempts", attempts);
        return new MonitorResult(MonitorResult.Status.INTERRUPTED, last, attempts);
    }
}
