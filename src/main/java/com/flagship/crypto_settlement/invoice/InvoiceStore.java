package com.flagship.crypto_settlement.invoice;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Read and transition access to invoices.
 *
 * Bridges the {@link Invoice} domain object and {@link InvoiceEntity}.
 * Status changes go through the domain object so invalid transitions are
 * rejected before anything is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceStore {

    private final InvoiceRepository invoiceRepository;

    @Transactional
    public Invoice save(Invoice invoice) {
        InvoiceEntity saved = invoiceRepository.save(InvoiceEntity.fromDomain(invoice));
        log.debug("Saved invoice {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Invoice> findById(UUID invoiceId) {
        return invoiceRepository.findById(invoiceId).map(InvoiceEntity::toDomain);
    }

    /**
     * Moves an invoice to PAID inside the caller's transaction.
     *
     * @throws IllegalArgumentException if the invoice does not exist
     * @throws IllegalStateException if the invoice is already terminal
     */
    @Transactional
    public Invoice markPaid(UUID invoiceId) {
        InvoiceEntity entity = invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new IllegalArgumentException("Invoice not found: " + invoiceId));
        Invoice paid = entity.toDomain().markPaid();
        entity.updateFromDomain(paid);
        invoiceRepository.save(entity);
        log.debug("Invoice {} marked PAID", invoiceId);
        return paid;
    }

    /**
     * Moves an invoice whose payment window has passed to EXPIRED.
     */
    @Transactional
    public Invoice expire(UUID invoiceId) {
        InvoiceEntity entity = invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new IllegalArgumentException("Invoice not found: " + invoiceId));
        Invoice expired = entity.toDomain().expire();
        entity.updateFromDomain(expired);
        invoiceRepository.save(entity);
        log.info("Invoice {} expired", invoiceId);
        return expired;
    }
}
