package com.flagship.retainer_settlement.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retainer_settlement.deal.Deal;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class EligibleDealResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("submission_id")
    String submissionId;

    @JsonProperty("insured_name")
    String insuredName;

    @JsonProperty("lead_vendor")
    String leadVendor;

    @JsonProperty("date")
    LocalDate dateSigned;

    @JsonProperty("status")
    String status;

    @JsonProperty("carrier")
    String carrier;

    @JsonProperty("face_amount")
    BigDecimal faceAmount;

    @JsonProperty("created_at")
    Instant createdAt;

    public static EligibleDealResponse from(Deal deal) {
        return EligibleDealResponse.builder()
            .id(deal.getId())
            .submissionId(deal.getSubmissionId())
            .insuredName(deal.getInsuredName())
            .leadVendor(deal.getLeadVendor())
            .dateSigned(deal.getDateSigned())
            .status(deal.getStatus())
            .carrier(deal.getCarrier())
            .faceAmount(deal.getFaceAmount())
            .createdAt(deal.getCreatedAt())
            .build();
    }
}
