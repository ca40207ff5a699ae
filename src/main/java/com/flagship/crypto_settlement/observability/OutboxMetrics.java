package com.flagship.crypto_settlement.observability;

import com.flagship.crypto_settlement.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges: backlog size, age of the oldest pending sync job, and
 * jobs past the retry limit. Values are cached and refreshed by
 * {@link MetricsScheduler} so scrapes never hit the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong failedEventCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
            .description("Sync jobs waiting to be published")
            .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
            .description("Age of the oldest unpublished sync job")
            .register(meterRegistry);

        Gauge.builder("outbox.events.failed", failedEventCount, AtomicLong::get)
            .description("Sync jobs that exceeded the retry limit")
            .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = outboxRepository.countUnpublished();
            backlogSize.set(unpublished);

            long age = outboxRepository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                .orElse(0L);
            oldestEventAgeSeconds.set(age);

            failedEventCount.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                unpublished, age, failedEventCount.get());
        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }
}
