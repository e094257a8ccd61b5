package com.flagship.retainer_settlement.pipeline;

import lombok.Value;

import java.util.Objects;

/**
 * Inbound/outbound payment status pair of a deal.
 *
 * Invariant: outbound PAID implies inbound RECEIVED. The constructor rejects any other
 * combination, so an instance violating the safety lock cannot exist.
 */
@Value
public class PaymentState {

    public static final PaymentState UNSETTLED = new PaymentState(InboundStatus.PENDING, OutboundStatus.LOCKED);
    public static final PaymentState INBOUND_RECEIVED = new PaymentState(InboundStatus.RECEIVED, OutboundStatus.LOCKED);
    public static final PaymentState SETTLED = new PaymentState(InboundStatus.RECEIVED, OutboundStatus.PAID);

    InboundStatus inbound;
    OutboundStatus outbound;

    public PaymentState(InboundStatus inbound, OutboundStatus outbound) {
        this.inbound = Objects.requireNonNull(inbound, "inbound");
        this.outbound = Objects.requireNonNull(outbound, "outbound");
        if (outbound == OutboundStatus.PAID && inbound != InboundStatus.RECEIVED) {
            throw new IllegalArgumentException("Outbound payment cannot be paid before inbound payment is received");
        }
    }

    public boolean isInboundReceived() {
        return inbound == InboundStatus.RECEIVED;
    }

    public boolean isOutboundPaid() {
        return outbound == OutboundStatus.PAID;
    }

    /**
     * Same outbound status, inbound flipped to RECEIVED.
     */
    public PaymentState withInboundReceived() {
        return new PaymentState(InboundStatus.RECEIVED, outbound);
    }
}
