package com.flagship.retainer_settlement.invoice;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link Invoice} and {@link InvoiceEntity}, including the JSON form of the line items.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoicePersistenceService {

    private static final TypeReference<List<LineItem>> ITEMS_TYPE = new TypeReference<>() {
    };

    private final InvoiceRepository invoiceRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public Invoice insert(Invoice invoice, String idempotencyKey) {
        InvoiceEntity saved = invoiceRepository.saveAndFlush(
                InvoiceEntity.fromDomain(invoice, writeItems(invoice), idempotencyKey));
        log.debug("Inserted invoice {} ({})", saved.getInvoiceNumber(), saved.getId());
        return toDomain(saved);
    }

    @Transactional
    public Invoice update(Invoice invoice) {
        InvoiceEntity existing = invoiceRepository.findById(invoice.getId())
                .orElseThrow(() -> new InvoiceNotFoundException(invoice.getId()));
        existing.updateFromDomain(invoice, writeItems(invoice));
        InvoiceEntity updated = invoiceRepository.saveAndFlush(existing);
        log.debug("Updated invoice {}", updated.getInvoiceNumber());
        return toDomain(updated);
    }

    @Transactional(readOnly = true)
    public Optional<Invoice> findById(UUID invoiceId) {
        return invoiceRepository.findById(invoiceId).map(this::toDomain);
    }

    /**
     * Matching invoices, newest first.
     */
    @Transactional(readOnly = true)
    public List<Invoice> findAll(InvoiceFilter filter) {
        return invoiceRepository.findAll(filter.toSpecification(), Sort.by(Sort.Direction.DESC, "createdAt"))
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countWithNumberPrefix(String prefix) {
        return invoiceRepository.countByInvoiceNumberStartingWith(prefix);
    }

    @Transactional
    public void delete(UUID invoiceId) {
        invoiceRepository.deleteById(invoiceId);
        invoiceRepository.flush();
    }

    private Invoice toDomain(InvoiceEntity entity) {
        return entity.toDomain(readItems(entity));
    }

    private String writeItems(Invoice invoice) {
        try {
            return objectMapper.writeValueAsString(invoice.getItems());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize line items of invoice " + invoice.getId(), e);
        }
    }

    private List<LineItem> readItems(InvoiceEntity entity) {
        if (entity.getItems() == null || entity.getItems().isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(objectMapper.readValue(entity.getItems(), ITEMS_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(String.format(
                "Line items of invoice %s are malformed: %s", entity.getInvoiceNumber(), e.getOriginalMessage()), e);
        }
    }
}
