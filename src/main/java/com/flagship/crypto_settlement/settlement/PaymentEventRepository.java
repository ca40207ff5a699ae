package com.flagship.crypto_settlement.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentEventRepository extends JpaRepository<PaymentEventEntity, UUID> {

    boolean existsByCorrelationId(String correlationId);

    /**
     * Matches confirmed events by any of the given transaction id spellings.
     * Rows written before ids were normalized may hold the at-form.
     */
    @Query("""
        SELECT e FROM PaymentEventEntity e
        WHERE e.eventType = :eventType AND e.hederaTransactionId IN :transactionIds
        ORDER BY e.createdAt ASC
        """)
    List<PaymentEventEntity> findByTransactionIds(@Param("eventType") PaymentEventType eventType,
                                                  @Param("transactionIds") Collection<String> transactionIds);

    Optional<PaymentEventEntity> findFirstByInvoiceIdAndEventTypeOrderByCreatedAtDesc(
        UUID invoiceId, PaymentEventType eventType);

    long countByInvoiceId(UUID invoiceId);
}
