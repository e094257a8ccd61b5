package com.flagship.retainer_settlement.invoice;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

final class InvoiceFixtures {

    static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private InvoiceFixtures() {
    }

    static InvoiceForm lawyerForm(UUID lawyerId, List<UUID> dealIds) {
        return InvoiceForm.builder()
                .invoiceType(InvoiceType.LAWYER)
                .lawyerId(lawyerId)
                .dateRangeStart(LocalDate.of(2024, 6, 1))
                .dateRangeEnd(LocalDate.of(2024, 6, 30))
                .dueDate(LocalDate.of(2024, 7, 15))
                .dealIds(dealIds)
                .item(LineItem.of("Fee", new BigDecimal("2"), new BigDecimal("100")))
                .taxRate(new BigDecimal("0.08"))
                .notes("June retainers")
                .build();
    }

    static InvoiceForm publisherForm(UUID centerId, List<UUID> dealIds) {
        return InvoiceForm.builder()
                .invoiceType(InvoiceType.PUBLISHER)
                .leadVendorId(centerId)
                .dateRangeStart(LocalDate.of(2024, 6, 1))
                .dateRangeEnd(LocalDate.of(2024, 6, 30))
                .dueDate(LocalDate.of(2024, 7, 15))
                .dealIds(dealIds)
                .item(LineItem.of("Leads", new BigDecimal("10"), new BigDecimal("45")))
                .taxRate(BigDecimal.ZERO)
                .build();
    }

    static Invoice invoice(InvoiceForm form, String number) {
        InvoiceComputationEngine engine = new InvoiceComputationEngine();
        List<LineItem> items = engine.validateLineItems(form.getItems());
        return Invoice.create(UUID.randomUUID(), number, form, items,
                engine.computeTotals(items, form.getTaxRate()), UUID.randomUUID(), NOW);
    }
}
