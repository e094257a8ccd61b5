package com.flagship.retainer_settlement.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retainer_settlement.pipeline.InboundStatus;
import com.flagship.retainer_settlement.pipeline.OutboundStatus;
import com.flagship.retainer_settlement.settlement.SettlementEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class SettlementView {

    @JsonProperty("deal_id")
    UUID dealId;

    @JsonProperty("submission_id")
    String submissionId;

    @JsonProperty("insured_name")
    String insuredName;

    @JsonProperty("client_phone_number")
    String clientPhoneNumber;

    @JsonProperty("lead_vendor")
    String leadVendor;

    @JsonProperty("date_signed")
    LocalDate dateSigned;

    @JsonProperty("status")
    String status;

    @JsonProperty("stage")
    String stage;

    @JsonProperty("assigned_attorney_id")
    UUID assignedAttorneyId;

    @JsonProperty("assigned_attorney_name")
    String assignedAttorneyName;

    @JsonProperty("face_amount")
    BigDecimal faceAmount;

    @JsonProperty("inbound_payment_status")
    InboundStatus inboundPaymentStatus;

    @JsonProperty("outbound_payment_status")
    OutboundStatus outboundPaymentStatus;

    @JsonProperty("can_pay_outbound")
    boolean canPayOutbound;

    @JsonProperty("created_at")
    Instant createdAt;

    public static SettlementView from(SettlementEntry entry, boolean canPayOutbound) {
        return SettlementView.builder()
            .dealId(entry.getDealId())
            .submissionId(entry.getSubmissionId())
            .insuredName(entry.getInsuredName())
            .clientPhoneNumber(entry.getClientPhoneNumber())
            .leadVendor(entry.getLeadVendor())
            .dateSigned(entry.getDateSigned())
            .status(entry.getStatus())
            .stage(entry.getStage().getKey())
            .assignedAttorneyId(entry.getAssignedAttorneyId())
            .assignedAttorneyName(entry.getAssignedAttorneyName())
            .faceAmount(entry.getFaceAmount())
            .inboundPaymentStatus(entry.getPaymentState().getInbound())
            .outboundPaymentStatus(entry.getPaymentState().getOutbound())
            .canPayOutbound(canPayOutbound)
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
