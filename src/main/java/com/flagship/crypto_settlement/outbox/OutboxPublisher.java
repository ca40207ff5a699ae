package com.flagship.crypto_settlement.outbox;

import com.flagship.crypto_settlement.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drains the outbox to Kafka.
 *
 * Each poll locks a batch with SKIP LOCKED, sends every event synchronously
 * keyed by aggregate id (one partition per invoice keeps its jobs ordered),
 * and records success or failure per event. Events past the retry limit
 * stay in the table for manual handling.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-sync:ledger-sync}")
    private String ledgerSyncTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Publishing {} outbox events", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Outbox event {} exceeded max retries ({}), left for manual handling: eventType={}, aggregateId={}",
                event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
            return;
        }

        try {
            SendResult<String, String> result = kafkaTemplate
                .send(topicFor(event), event.getAggregateId().toString(), event.getPayload())
                .get();

            log.debug("Published outbox event: eventId={}, topic={}, partition={}, offset={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish outbox event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        }
    }

    private String topicFor(OutboxEvent event) {
        return switch (event.getEventType()) {
            case LedgerSyncRequested.EVENT_TYPE -> ledgerSyncTopic;
            default -> throw new IllegalStateException("No topic for outbox event type " + event.getEventType());
        };
    }

    public void triggerPublish() {
        publishPendingEvents();
    }
}
