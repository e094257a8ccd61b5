package com.flagship.retainer_settlement.deal;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A lead/case record from the intake deal flow.
 *
 * Created upstream by intake; this service only changes its stage and invoice links.
 * {@code status} is free text in the store and doubles as the pipeline stage label.
 */
@Value
public class Deal {
    UUID id;
    String submissionId;
    String insuredName;
    String clientPhoneNumber;
    String leadVendor;
    LocalDate dateSigned;
    String status;
    UUID assignedAttorneyId;
    String agent;
    String carrier;
    BigDecimal faceAmount;
    UUID invoiceId;
    UUID publisherInvoiceId;
    Instant createdAt;

    public boolean isAssignedTo(UUID attorneyId) {
        return attorneyId != null && attorneyId.equals(assignedAttorneyId);
    }
}
