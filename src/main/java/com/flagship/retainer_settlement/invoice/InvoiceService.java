package com.flagship.retainer_settlement.invoice;

import com.flagship.retainer_settlement.deal.CounterpartyDirectory;
import com.flagship.retainer_settlement.deal.Deal;
import com.flagship.retainer_settlement.deal.DealPersistenceService;
import com.flagship.retainer_settlement.identity.CallerIdentity;
import com.flagship.retainer_settlement.identity.CallerNotAuthorizedException;
import com.flagship.retainer_settlement.invoice.event.InvoiceCreatedEvent;
import com.flagship.retainer_settlement.invoice.event.InvoiceStatusChangedEvent;
import com.flagship.retainer_settlement.observability.CorrelationContext;
import com.flagship.retainer_settlement.observability.SettlementMetrics;
import com.flagship.retainer_settlement.outbox.OutboxService;
import com.flagship.retainer_settlement.pipeline.PipelineStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Invoice authoring and lifecycle.
 *
 * Every write re-validates the form and recomputes totals; amounts sent by the caller are
 * never stored as given. Deal links are changed in the same transaction as the invoice, so
 * an edit whose new deal set cannot be linked leaves the old links and contents in place.
 *
 * Numbers are allocated by counting this year's invoices. Two invoices created at the same
 * moment can draw the same number; the unique constraint on {@code invoice_number} rejects
 * the second one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceService {

    private final InvoicePersistenceService persistenceService;
    private final InvoiceComputationEngine computationEngine;
    private final InvoiceDealLinker dealLinker;
    private final IdempotencyService idempotencyService;
    private final DealPersistenceService dealPersistenceService;
    private final CounterpartyDirectory counterpartyDirectory;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * The number the next invoice would get. Not reserved.
     */
    @Transactional(readOnly = true)
    public String previewNextNumber() {
        int year = LocalDate.now(clock).getYear();
        long existing = persistenceService.countWithNumberPrefix(computationEngine.numberPrefix(year));
        return computationEngine.generateInvoiceNumber(year, existing);
    }

    @Transactional
    public InvoiceCreation createInvoice(InvoiceForm form, CallerIdentity caller, String idempotencyKey) {
        caller.requireAnyRole(CallerIdentity.BACK_OFFICE, "create invoices");

        Optional<UUID> existingId = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (existingId.isPresent()) {
            Optional<Invoice> existing = persistenceService.findById(existingId.get());
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning invoice {}", existingId.get());
                return new InvoiceCreation(existing.get(), true);
            }
            // cached key of a deleted invoice
            log.warn("Idempotency key pointed at missing invoice {}, creating anew", existingId.get());
            idempotencyService.forgetKey(idempotencyKey);
        }
        metrics.recordIdempotencyMiss();

        long startTime = System.currentTimeMillis();
        computationEngine.requireSubmittable(form);
        List<LineItem> items = computationEngine.validateLineItems(form.getItems());
        InvoiceTotals totals = computationEngine.computeTotals(items, form.getTaxRate());
        String invoiceNumber = previewNextNumber();

        Invoice invoice = Invoice.create(UUID.randomUUID(), invoiceNumber, form, items, totals,
                caller.getUserId(), Instant.now(clock));
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoice.getId().toString());
        try {
            Invoice saved = persistenceService.insert(invoice, idempotencyKey);
            dealLinker.linkDeals(saved.getDealIds(), saved.getId(), saved.getInvoiceType());
            outboxService.recordInvoiceEvent(InvoiceCreatedEvent.fromInvoice(saved));
            idempotencyService.storeIdempotencyKey(idempotencyKey, saved.getId());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordInvoiceCreated(saved.getInvoiceType().getValue());
            metrics.recordPersistenceLatency("create_invoice", duration);
            log.info("Invoice {} created: type={}, deals={}, total={}, duration={}ms",
                    saved.getInvoiceNumber(), saved.getInvoiceType().getValue(),
                    saved.getDealIds().size(), saved.getTotalAmount(), duration);
            return new InvoiceCreation(saved, false);
        } catch (RuntimeException e) {
            log.error("Invoice creation failed: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * Revises a pending invoice: unlink the old deal set, store the new contents, link the new deal set.
     */
    @Transactional
    public Invoice updateInvoice(UUID invoiceId, InvoiceForm form, CallerIdentity caller) {
        caller.requireAnyRole(CallerIdentity.BACK_OFFICE, "edit invoices");
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        try {
            Invoice current = load(invoiceId);
            computationEngine.requireSubmittable(form);
            List<LineItem> items = computationEngine.validateLineItems(form.getItems());
            InvoiceTotals totals = computationEngine.computeTotals(items, form.getTaxRate());
            Invoice revised = current.revise(form, items, totals, Instant.now(clock));

            int unlinked = dealLinker.unlinkDeals(invoiceId, current.getInvoiceType());
            Invoice saved = persistenceService.update(revised);
            LinkResult linked = dealLinker.linkDeals(saved.getDealIds(), saved.getId(), saved.getInvoiceType());

            log.info("Invoice {} updated: unlinked={}, linked={}/{}, total={}", saved.getInvoiceNumber(),
                    unlinked, linked.getLinked(), linked.getRequested(), saved.getTotalAmount());
            return saved;
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Invoice getInvoice(UUID invoiceId, CallerIdentity caller) {
        Invoice invoice = load(invoiceId);
        requireVisible(invoice, caller);
        return invoice;
    }

    @Transactional(readOnly = true)
    public List<Invoice> listInvoices(InvoiceFilter filter, CallerIdentity caller) {
        if (!caller.isLawyer()) {
            caller.requireAnyRole(CallerIdentity.BACK_OFFICE, "list invoices");
        }
        return persistenceService.findAll(filter.restrictedTo(caller));
    }

    /**
     * Marks an invoice paid. Deals billed by a paid publisher invoice move to "Paid to BPO".
     */
    @Transactional
    public Invoice markPaid(UUID invoiceId, CallerIdentity caller) {
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        try {
            Invoice current = load(invoiceId);
            if (!caller.hasAnyRole(CallerIdentity.BACK_OFFICE) && !isOwnLawyerInvoice(current, caller)) {
                throw new CallerNotAuthorizedException("Only back office or the billed lawyer may mark an invoice paid");
            }
            Invoice paid = changeStatus(current, InvoiceStatus.PAID);
            if (paid != current && paid.getInvoiceType() == InvoiceType.PUBLISHER && !paid.getDealIds().isEmpty()) {
                int advanced = dealPersistenceService.advanceToStage(paid.getDealIds(), PipelineStage.PAID_TO_BPO);
                log.info("Advanced {} deals of invoice {} to '{}'",
                        advanced, paid.getInvoiceNumber(), PipelineStage.PAID_TO_BPO.getLabel());
            }
            return paid;
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    @Transactional
    public Invoice requestChargeback(UUID invoiceId, CallerIdentity caller) {
        caller.requireAnyRole(CallerIdentity.BACK_OFFICE, "charge back invoices");
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        try {
            return changeStatus(load(invoiceId), InvoiceStatus.CHARGEBACK);
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * Deletes an invoice after clearing every deal link that points at it.
     */
    @Transactional
    public void deleteInvoice(UUID invoiceId, CallerIdentity caller) {
        caller.requireAnyRole(CallerIdentity.BACK_OFFICE, "delete invoices");
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        try {
            Invoice invoice = load(invoiceId);
            idempotencyService.forgetInvoice(invoiceId);
            int unlinked = dealLinker.unlinkDeals(invoiceId, InvoiceType.LAWYER)
                    + dealLinker.unlinkDeals(invoiceId, InvoiceType.PUBLISHER);
            persistenceService.delete(invoiceId);
            log.info("Invoice {} deleted, {} deal links cleared", invoice.getInvoiceNumber(), unlinked);
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * Deals that may be put on an invoice of {@code type} for {@code counterpartyId}.
     *
     * Lawyer invoices take the lawyer's deals created in the date range, both ends inclusive.
     * Publisher invoices take the vendor's deals in "Approved – Payable", the date range being optional.
     * Deals already billed by a different invoice of the same type are left out; pass
     * {@code editingInvoiceId} to keep the deals of the invoice being edited.
     */
    @Transactional(readOnly = true)
    public List<Deal> listEligibleDeals(InvoiceType type, UUID counterpartyId, LocalDate from, LocalDate to,
                                        UUID editingInvoiceId, CallerIdentity caller) {
        caller.requireAnyRole(CallerIdentity.BACK_OFFICE, "author invoices");
        Objects.requireNonNull(type, "type");
        if (counterpartyId == null) {
            throw new IllegalArgumentException("Counterparty is required");
        }

        List<Deal> candidates;
        if (type == InvoiceType.LAWYER) {
            if (from == null || to == null) {
                throw new IllegalArgumentException("Date range is required for lawyer invoices");
            }
            candidates = dealPersistenceService.findForAttorney(counterpartyId, from, to);
        } else {
            String leadVendor = counterpartyDirectory.leadVendorName(counterpartyId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown lead vendor: " + counterpartyId));
            candidates = dealPersistenceService.findForLeadVendor(leadVendor, PipelineStage.APPROVED_PAYABLE, from, to);
        }
        return candidates.stream()
                .filter(deal -> isUnbilledOrEditing(deal, type, editingInvoiceId))
                .toList();
    }

    private Invoice changeStatus(Invoice current, InvoiceStatus target) {
        InvoiceStatus previous = current.getStatus();
        Invoice changed = current.transitionTo(target, Instant.now(clock));
        if (changed == current) {
            log.info("Invoice {} already {}", current.getInvoiceNumber(), target.getValue());
            return current;
        }
        Invoice saved = persistenceService.update(changed);
        outboxService.recordInvoiceEvent(InvoiceStatusChangedEvent.of(saved, previous));
        metrics.recordInvoiceStatusChanged(target.getValue());
        log.info("Invoice {} moved from {} to {}", saved.getInvoiceNumber(), previous.getValue(), target.getValue());
        return saved;
    }

    private Invoice load(UUID invoiceId) {
        return persistenceService.findById(invoiceId)
                .orElseThrow(() -> new InvoiceNotFoundException(invoiceId));
    }

    private void requireVisible(Invoice invoice, CallerIdentity caller) {
        if (caller.isLawyer()) {
            if (!isOwnLawyerInvoice(invoice, caller)) {
                throw new CallerNotAuthorizedException("Lawyers may only view their own invoices");
            }
            return;
        }
        caller.requireAnyRole(CallerIdentity.BACK_OFFICE, "view invoices");
    }

    private static boolean isOwnLawyerInvoice(Invoice invoice, CallerIdentity caller) {
        return caller.isLawyer()
                && invoice.getInvoiceType() == InvoiceType.LAWYER
                && caller.getUserId().equals(invoice.getLawyerId());
    }

    private static boolean isUnbilledOrEditing(Deal deal, InvoiceType type, UUID editingInvoiceId) {
        UUID linkedTo = type == InvoiceType.LAWYER ? deal.getInvoiceId() : deal.getPublisherInvoiceId();
        return linkedTo == null || linkedTo.equals(editingInvoiceId);
    }
}
