package com.flagship.retainer_settlement.pipeline;

/**
 * Maps a stage label to its canonical payment state.
 *
 * Total function: unknown and null labels are treated as not yet settled.
 */
public final class PaymentStateDeriver {

    private PaymentStateDeriver() {
        // Utility class
    }

    public static PaymentState derive(String statusLabel) {
        if (PipelineStage.PAID_TO_BPO.getLabel().equals(statusLabel)) {
            return PaymentState.SETTLED;
        }
        return PaymentState.UNSETTLED;
    }

    public static PaymentState derive(PipelineStage stage) {
        return derive(stage == null ? null : stage.getLabel());
    }
}
