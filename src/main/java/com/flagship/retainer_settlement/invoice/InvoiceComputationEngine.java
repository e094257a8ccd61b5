package com.flagship.retainer_settlement.invoice;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-item validation, totals and numbering for invoices.
 *
 * Amounts are rounded to cents, half away from zero, at every step: each line amount,
 * then the tax on the rounded subtotal. Historical invoices were computed in this order;
 * changing it moves totals by a cent.
 */
@Component
public class InvoiceComputationEngine {

    static final int MONEY_SCALE = 2;
    // invoices.tax_rate is NUMERIC(6, 4); a finer rate would be rounded on insert
    static final int TAX_RATE_SCALE = 4;
    private static final String NUMBER_PREFIX = "INV-";

    /**
     * Keeps items with a non-blank description, positive quantity and positive unit price,
     * and recomputes each amount. Caller-supplied amounts are ignored.
     */
    public List<LineItem> validateLineItems(List<LineItem> items) {
        List<LineItem> valid = new ArrayList<>();
        if (items == null) {
            return valid;
        }
        for (LineItem item : items) {
            if (item == null || !isValid(item)) {
                continue;
            }
            valid.add(new LineItem(
                item.getDescription(),
                item.getQuantity(),
                item.getUnitPrice(),
                round(item.getQuantity().multiply(item.getUnitPrice()))
            ));
        }
        return valid;
    }

    /**
     * @param validItems items returned by {@link #validateLineItems(List)}
     * @param taxRate fraction, e.g. 0.08 for 8%; null is treated as zero
     */
    public InvoiceTotals computeTotals(List<LineItem> validItems, BigDecimal taxRate) {
        BigDecimal subtotal = round(validItems.stream()
                .map(LineItem::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
        BigDecimal rate = taxRate == null ? BigDecimal.ZERO : taxRate;
        BigDecimal taxAmount = round(subtotal.multiply(rate));
        return new InvoiceTotals(subtotal, taxAmount, subtotal.add(taxAmount));
    }

    /**
     * {@code INV-<year>-<count + 1>}, the sequence part zero-padded to four digits.
     */
    public String generateInvoiceNumber(int year, long existingCountForYear) {
        if (existingCountForYear < 0) {
            throw new IllegalArgumentException("Existing invoice count cannot be negative");
        }
        return String.format("%s%d-%04d", NUMBER_PREFIX, year, existingCountForYear + 1);
    }

    public String numberPrefix(int year) {
        return NUMBER_PREFIX + year + "-";
    }

    /**
     * The submission checks that fail for {@code form}; empty when it can be submitted.
     */
    public List<String> validateForm(InvoiceForm form) {
        List<String> problems = new ArrayList<>();
        if (form.getInvoiceType() == null) {
            problems.add("invoice type is required");
        } else if (form.counterpartyId() == null) {
            problems.add(form.getInvoiceType() == InvoiceType.LAWYER
                    ? "lawyer is required"
                    : "lead vendor is required");
        }
        if (form.getDateRangeStart() == null || form.getDateRangeEnd() == null) {
            problems.add("date range is incomplete");
        } else if (form.getDateRangeStart().isAfter(form.getDateRangeEnd())) {
            problems.add("date range starts after it ends");
        }
        if (form.getDueDate() == null) {
            problems.add("due date is required");
        }
        if (validateLineItems(form.getItems()).isEmpty()) {
            problems.add("at least one valid line item is required");
        }
        BigDecimal taxRate = form.getTaxRate();
        if (taxRate != null && (taxRate.signum() < 0 || taxRate.compareTo(BigDecimal.ONE) > 0)) {
            problems.add("tax rate must be between 0 and 1");
        } else if (taxRate != null && taxRate.stripTrailingZeros().scale() > TAX_RATE_SCALE) {
            problems.add("tax rate allows at most " + TAX_RATE_SCALE + " decimal places");
        }
        return problems;
    }

    public boolean canSubmit(InvoiceForm form) {
        return validateForm(form).isEmpty();
    }

    /**
     * @throws InvoiceValidationException listing every failed check
     */
    public void requireSubmittable(InvoiceForm form) {
        List<String> problems = validateForm(form);
        if (!problems.isEmpty()) {
            throw new InvoiceValidationException(problems);
        }
    }

    private static boolean isValid(LineItem item) {
        return item.getDescription() != null
                && !item.getDescription().trim().isEmpty()
                && item.getQuantity() != null
                && item.getQuantity().signum() > 0
                && item.getUnitPrice() != null
                && item.getUnitPrice().signum() > 0;
    }

    static BigDecimal round(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
