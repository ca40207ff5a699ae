package com.flagship.crypto_settlement.settlement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for {@link PaymentEvent}. Metadata is stored as jsonb.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentEventStore {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final PaymentEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Appends an event inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentEvent append(PaymentEvent event) {
        repository.save(PaymentEventEntity.fromDomain(event, writeMetadata(event.getMetadata())));
        log.debug("Appended payment event: invoiceId={}, type={}, txId={}",
            event.getInvoiceId(), event.getEventType(), event.getHederaTransactionId());
        return event;
    }

    @Transactional(readOnly = true)
    public Optional<PaymentEvent> findConfirmation(UUID invoiceId) {
        return repository.findFirstByInvoiceIdAndEventTypeOrderByCreatedAtDesc(invoiceId, PaymentEventType.PAYMENT_CONFIRMED)
            .map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public long countForInvoice(UUID invoiceId) {
        return repository.countByInvoiceId(invoiceId);
    }

    private PaymentEvent toDomain(PaymentEventEntity entity) {
        return new PaymentEvent(
            entity.getId(),
            entity.getInvoiceId(),
            entity.getEventType(),
            entity.getPaymentMethod(),
            entity.getHederaTransactionId(),
            entity.getAmountReceived(),
            entity.getCurrencyReceived(),
            entity.getCorrelationId(),
            readMetadata(entity.getMetadata()),
            entity.getCreatedAt()
        );
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize payment event metadata", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payment event metadata is not valid JSON", e);
        }
    }
}
