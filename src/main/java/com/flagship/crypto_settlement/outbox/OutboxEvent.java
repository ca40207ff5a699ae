package com.flagship.crypto_settlement.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A message waiting in the outbox table to be published to Kafka.
 *
 * Written in the same database transaction as the state it describes and
 * published later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
