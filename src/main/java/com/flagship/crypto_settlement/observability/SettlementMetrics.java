package com.flagship.crypto_settlement.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for detection and settlement.
 *
 * Metrics exposed:
 * - matcher.checks: mirror node checks by result (found, not_found, error)
 * - settlement.confirmed: settlement attempts by token and status
 * - settlement.duplicates: duplicate confirmations absorbed as no-ops
 * - settlement.lock.contention: attempts rejected because the invoice was locked
 * - settlement.ledger.failures: ledger postings that failed after confirmation
 * - settlement.latency: operation timings
 * - idempotency.cache: Redis fast-path hits and misses
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    private final Counter duplicates;
    private final Counter lockContention;
    private final Counter ledgerFailures;
    private final Timer settlementTimer;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicates = Counter.builder("settlement.duplicates")
                .description("Confirmations ignored because the transaction was already recorded")
                .register(registry);

        this.lockContention = Counter.builder("settlement.lock.contention")
                .description("Settlement attempts rejected because another request held the invoice lock")
                .register(registry);

        this.ledgerFailures = Counter.builder("settlement.ledger.failures")
                .description("Ledger postings that failed after the invoice was confirmed")
                .register(registry);

        this.settlementTimer = Timer.builder("settlement.duration")
                .description("Time taken to confirm a payment and post it")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordMatcherCheck(String result) {
        registry.counter("matcher.checks", "result", sanitizeTag(result)).increment();
    }

    public void recordSettlement(String token, String status) {
        registry.counter("settlement.confirmed",
                "token", sanitizeTag(token),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void incrementDuplicates() {
        duplicates.increment();
    }

    public void incrementLockContention() {
        lockContention.increment();
    }

    public void incrementLedgerFailures() {
        ledgerFailures.increment();
    }

    public void recordSettlementDuration(Duration duration) {
        settlementTimer.record(duration);
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("settlement.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
