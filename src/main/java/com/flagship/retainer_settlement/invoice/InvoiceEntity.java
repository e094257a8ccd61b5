package com.flagship.retainer_settlement.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * JPA mapping of the {@code invoices} table.
 *
 * No setters. {@code items} is raw JSON here; {@link InvoicePersistenceService} owns the
 * conversion to and from {@link LineItem}.
 */
@Entity
@Table(
    name = "invoices",
    uniqueConstraints = @UniqueConstraint(name = "uk_invoices_invoice_number", columnNames = "invoice_number"),
    indexes = {
        @Index(name = "idx_invoices_lawyer_id", columnList = "lawyer_id"),
        @Index(name = "idx_invoices_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_number", nullable = false, updatable = false, length = 32)
    private String invoiceNumber;

    @Convert(converter = InvoiceTypeConverter.class)
    @Column(name = "invoice_type", nullable = false, updatable = false, length = 16)
    private InvoiceType invoiceType;

    @Column(name = "lawyer_id")
    private UUID lawyerId;

    @Column(name = "lead_vendor_id")
    private UUID leadVendorId;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "date_range_start", nullable = false)
    private LocalDate dateRangeStart;

    @Column(name = "date_range_end", nullable = false)
    private LocalDate dateRangeEnd;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "deal_ids", columnDefinition = "uuid[]")
    private UUID[] dealIds;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "items", nullable = false, columnDefinition = "jsonb")
    private String items;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax_rate", nullable = false, precision = 6, scale = 4)
    private BigDecimal taxRate;

    @Column(name = "tax_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Convert(converter = InvoiceStatusConverter.class)
    @Column(nullable = false, length = 16)
    private InvoiceStatus status;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    static InvoiceEntity fromDomain(Invoice invoice, String itemsJson, String idempotencyKey) {
        InvoiceEntity entity = new InvoiceEntity();
        entity.id = invoice.getId();
        entity.invoiceNumber = invoice.getInvoiceNumber();
        entity.invoiceType = invoice.getInvoiceType();
        entity.createdBy = invoice.getCreatedBy();
        entity.idempotencyKey = idempotencyKey;
        entity.createdAt = invoice.getCreatedAt();
        entity.copyContents(invoice, itemsJson);
        return entity;
    }

    /**
     * Number, type, creator and idempotency key never change after insert.
     */
    void updateFromDomain(Invoice invoice, String itemsJson) {
        copyContents(invoice, itemsJson);
    }

    Invoice toDomain(List<LineItem> parsedItems) {
        return new Invoice(
            id,
            invoiceNumber,
            invoiceType,
            lawyerId,
            leadVendorId,
            createdBy,
            dateRangeStart,
            dateRangeEnd,
            dealIds == null ? List.of() : Arrays.asList(dealIds.clone()),
            parsedItems,
            subtotal,
            taxRate,
            taxAmount,
            totalAmount,
            status,
            notes,
            dueDate,
            createdAt,
            updatedAt
        );
    }

    private void copyContents(Invoice invoice, String itemsJson) {
        this.lawyerId = invoice.getLawyerId();
        this.leadVendorId = invoice.getLeadVendorId();
        this.dateRangeStart = invoice.getDateRangeStart();
        this.dateRangeEnd = invoice.getDateRangeEnd();
        this.dealIds = invoice.getDealIds().toArray(new UUID[0]);
        this.items = itemsJson;
        this.subtotal = invoice.getSubtotal();
        this.taxRate = invoice.getTaxRate();
        this.taxAmount = invoice.getTaxAmount();
        this.totalAmount = invoice.getTotalAmount();
        this.status = invoice.getStatus();
        this.notes = invoice.getNotes();
        this.dueDate = invoice.getDueDate();
    }
}
