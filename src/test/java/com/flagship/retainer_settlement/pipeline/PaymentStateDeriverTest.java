package com.flagship.retainer_settlement.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PaymentStateDeriverTest {

    @Test
    @DisplayName("Paid to BPO derives received/paid")
    void paidToBpoIsSettled() {
        PaymentState state = PaymentStateDeriver.derive("Paid to BPO");

        assertEquals(InboundStatus.RECEIVED, state.getInbound());
        assertEquals(OutboundStatus.PAID, state.getOutbound());
    }

    @Test
    @DisplayName("Attorney Review derives pending/locked")
    void attorneyReviewIsUnsettled() {
        assertEquals(PaymentState.UNSETTLED, PaymentStateDeriver.derive("Attorney Review"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Retainer Signed", "Approved – Payable", "Approved - Payable", "paid to bpo", "Lead Received"})
    @DisplayName("Every label other than exactly 'Paid to BPO' derives pending/locked")
    void otherLabelsAreUnsettled(String label) {
        assertEquals(PaymentState.UNSETTLED, PaymentStateDeriver.derive(label));
    }

    @Test
    @DisplayName("Outbound paid implies inbound received for every registered stage")
    void safetyLockHoldsForAllStages() {
        for (PipelineStage stage : PipelineStage.values()) {
            PaymentState state = PaymentStateDeriver.derive(stage.getLabel());
            if (state.isOutboundPaid()) {
                assertTrue(state.isInboundReceived(), stage.getLabel());
            }
            assertEquals(state, PaymentStateDeriver.derive(stage));
        }
    }

    @Test
    @DisplayName("A payment state with outbound paid and inbound pending cannot be built")
    void rejectsPaidWithoutReceived() {
        assertThrows(IllegalArgumentException.class,
                () -> new PaymentState(InboundStatus.PENDING, OutboundStatus.PAID));
    }

    @Test
    @DisplayName("withInboundReceived keeps the outbound status")
    void withInboundReceived() {
        assertEquals(PaymentState.INBOUND_RECEIVED, PaymentState.UNSETTLED.withInboundReceived());
        assertEquals(PaymentState.SETTLED, PaymentState.SETTLED.withInboundReceived());
    }
}
