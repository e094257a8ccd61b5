package com.flagship.retainer_settlement.settlement;

import com.flagship.retainer_settlement.deal.Deal;
import com.flagship.retainer_settlement.pipeline.PaymentState;
import com.flagship.retainer_settlement.pipeline.PaymentStateDeriver;
import com.flagship.retainer_settlement.pipeline.PipelineStage;
import com.flagship.retainer_settlement.pipeline.StageRegistry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One deal as seen by the settlement ledger.
 *
 * Immutable: a stage change or payment mark produces a new entry, and the ledger swaps it in
 * with a single write.
 */
@Value
public class SettlementEntry {
    UUID dealId;
    String submissionId;
    String insuredName;
    String clientPhoneNumber;
    String leadVendor;
    LocalDate dateSigned;
    PipelineStage stage;
    UUID assignedAttorneyId;
    String assignedAttorneyName;
    BigDecimal faceAmount;
    PaymentState paymentState;
    Instant createdAt;

    /**
     * Builds an entry from a stored deal, deriving the payment state from its stage.
     *
     * @throws IllegalArgumentException if the deal's status is not a settlement stage
     */
    public static SettlementEntry fromDeal(Deal deal, String attorneyName) {
        PipelineStage stage = StageRegistry.fromLabel(deal.getStatus())
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                    "Deal %s has status '%s', which is not a settlement stage",
                    deal.getId(), deal.getStatus())));
        return new SettlementEntry(
            deal.getId(),
            deal.getSubmissionId(),
            deal.getInsuredName(),
            deal.getClientPhoneNumber(),
            deal.getLeadVendor(),
            deal.getDateSigned(),
            stage,
            deal.getAssignedAttorneyId(),
            attorneyName,
            deal.getFaceAmount(),
            PaymentStateDeriver.derive(stage),
            deal.getCreatedAt()
        );
    }

    public String getStatus() {
        return stage.getLabel();
    }

    SettlementEntry movedTo(PipelineStage newStage, PaymentState newPaymentState) {
        return new SettlementEntry(
            dealId,
            submissionId,
            insuredName,
            clientPhoneNumber,
            leadVendor,
            dateSigned,
            newStage,
            assignedAttorneyId,
            assignedAttorneyName,
            faceAmount,
            newPaymentState,
            createdAt
        );
    }

    SettlementEntry withPaymentState(PaymentState newPaymentState) {
        return movedTo(stage, newPaymentState);
    }
}
