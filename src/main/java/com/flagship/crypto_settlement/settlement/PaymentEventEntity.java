package com.flagship.crypto_settlement.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payment_events. Rows are inserted once and never updated,
 * so every column is {@code updatable = false}.
 */
@Entity
@Table(
    name = "payment_events",
    indexes = {
        @Index(name = "idx_payment_events_invoice", columnList = "invoice_id"),
        @Index(name = "idx_payment_events_correlation", columnList = "correlation_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEventEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_id", nullable = false, updatable = false)
    private UUID invoiceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 32)
    private PaymentEventType eventType;

    @Column(name = "payment_method", nullable = false, updatable = false, length = 16)
    private String paymentMethod;

    @Column(name = "hedera_transaction_id", updatable = false, length = 64)
    private String hederaTransactionId;

    @Column(name = "amount_received", updatable = false, precision = 38, scale = 18)
    private BigDecimal amountReceived;

    @Column(name = "currency_received", updatable = false, length = 8)
    private String currencyReceived;

    @Column(name = "correlation_id", updatable = false, length = 128)
    private String correlationId;

    @Column(name = "metadata", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static PaymentEventEntity fromDomain(PaymentEvent event, String metadataJson) {
        return new PaymentEventEntity(
            event.getId(),
            event.getInvoiceId(),
            event.getEventType(),
            event.getPaymentMethod(),
            event.getHederaTransactionId(),
            event.getAmountReceived(),
            event.getCurrencyReceived(),
            event.getCorrelationId(),
            metadataJson,
            event.getCreatedAt()
        );
    }
}
