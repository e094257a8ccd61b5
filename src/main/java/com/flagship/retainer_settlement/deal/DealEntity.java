package com.flagship.retainer_settlement.deal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA mapping of the intake {@code daily_deal_flow} table.
 *
 * Rows are owned by intake. There are no setters: stage and invoice-link changes go through
 * the bulk update queries on {@link DealRepository}, which report how many rows they touched.
 */
@Entity
@Table(name = "daily_deal_flow")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DealEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "submission_id", nullable = false, updatable = false)
    private String submissionId;

    @Column(name = "insured_name")
    private String insuredName;

    @Column(name = "client_phone_number")
    private String clientPhoneNumber;

    @Column(name = "lead_vendor")
    private String leadVendor;

    @Column(name = "date")
    private LocalDate dateSigned;

    @Column(name = "status")
    private String status;

    @Column(name = "assigned_attorney_id")
    private UUID assignedAttorneyId;

    @Column(name = "agent")
    private String agent;

    @Column(name = "carrier")
    private String carrier;

    @Column(name = "face_amount", precision = 14, scale = 2)
    private BigDecimal faceAmount;

    @Column(name = "invoice_id")
    private UUID invoiceId;

    @Column(name = "publisher_invoice_id")
    private UUID publisherInvoiceId;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    /**
     * Maps the row to the typed domain object.
     *
     * @throws IllegalStateException if the row lacks the identifiers every deal must have
     */
    public Deal toDomain() {
        if (id == null || submissionId == null) {
            throw new IllegalStateException("Malformed deal row: id and submission_id are required");
        }
        return new Deal(
            id,
            submissionId,
            insuredName,
            clientPhoneNumber,
            leadVendor,
            dateSigned,
            status,
            assignedAttorneyId,
            agent,
            carrier,
            faceAmount,
            invoiceId,
            publisherInvoiceId,
            createdAt
        );
    }
}
