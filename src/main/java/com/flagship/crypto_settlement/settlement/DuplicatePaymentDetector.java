package com.flagship.crypto_settlement.settlement;

import com.flagship.crypto_settlement.hedera.TransactionIdNormalizer;
import com.flagship.crypto_settlement.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Detects payments that were already recorded.
 *
 * Strategy:
 * 1. Redis first (fast, may be unavailable)
 * 2. Database by correlation id
 * 3. Database by every spelling of the transaction id (raw, dash form, at form),
 *    which catches rows written before ids were normalized
 *
 * The database is the source of truth; Redis only ever answers "seen".
 */
@Service
@Slf4j
public class DuplicatePaymentDetector {

    private static final String REDIS_KEY_PREFIX = "settlement:correlation:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentEventRepository paymentEventRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final SettlementMetrics metrics;

    public DuplicatePaymentDetector(PaymentEventRepository paymentEventRepository,
                                    Optional<RedisTemplate<String, String>> redisTemplate,
                                    SettlementMetrics metrics) {
        this.paymentEventRepository = paymentEventRepository;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    @Transactional(readOnly = true)
    public DuplicateCheck check(String correlationId, String rawTransactionId) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("Correlation id cannot be null or blank");
        }

        Optional<UUID> cached = lookupCache(correlationId);
        if (cached.isPresent()) {
            metrics.recordIdempotencyHit();
            log.debug("Duplicate payment found in Redis: correlationId={}", correlationId);
            return DuplicateCheck.found(cached.get(), "Payment already processed");
        }
        metrics.recordIdempotencyMiss();

        if (paymentEventRepository.existsByCorrelationId(correlationId)) {
            log.warn("Duplicate payment detected by correlation id: correlationId={}", correlationId);
            return DuplicateCheck.found(null, "Payment already processed");
        }

        List<PaymentEventEntity> existing = paymentEventRepository.findByTransactionIds(
            PaymentEventType.PAYMENT_CONFIRMED, transactionIdSpellings(rawTransactionId));
        if (!existing.isEmpty()) {
            PaymentEventEntity event = existing.get(0);
            log.warn("Duplicate payment detected by transaction id: txId={}, existingEventId={}, invoiceId={}",
                rawTransactionId, event.getId(), event.getInvoiceId());
            remember(correlationId, event.getInvoiceId());
            return DuplicateCheck.found(event.getInvoiceId(),
                "This HEDERA payment has already been processed at " + event.getCreatedAt());
        }

        return DuplicateCheck.none();
    }

    /**
     * Caches a committed settlement. Best effort.
     */
    public void remember(String correlationId, UUID invoiceId) {
        if (redisTemplate.isEmpty() || invoiceId == null) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + correlationId, invoiceId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache correlation id in Redis: {}", e.getMessage());
        }
    }

    static Set<String> transactionIdSpellings(String rawTransactionId) {
        Set<String> spellings = new LinkedHashSet<>();
        if (rawTransactionId == null || rawTransactionId.isBlank()) {
            return spellings;
        }
        String trimmed = rawTransactionId.trim();
        spellings.add(trimmed);
        String normalized = TransactionIdNormalizer.normalize(trimmed);
        spellings.add(normalized);
        if (TransactionIdNormalizer.isNormalizedFormat(normalized)) {
            spellings.add(TransactionIdNormalizer.toAtFormat(normalized));
        }
        return spellings;
    }

    private Optional<UUID> lookupCache(String correlationId) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String invoiceId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + correlationId);
            return Optional.ofNullable(invoiceId).map(UUID::fromString);
        } catch (Exception e) {
            log.warn("Redis lookup failed for correlation id: {}. Falling back to database. Error: {}",
                correlationId, e.getMessage());
            return Optional.empty();
        }
    }
}
