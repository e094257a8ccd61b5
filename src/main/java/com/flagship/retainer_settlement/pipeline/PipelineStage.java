package com.flagship.retainer_settlement.pipeline;

/**
 * Settlement stages of the intake pipeline.
 *
 * Only the stages from "Retainer Signed" onwards take part in settlement tracking.
 * The label is the literal text stored in {@code daily_deal_flow.status}; the display order
 * continues the numbering of the wider intake pipeline, which is why it starts at 7.
 */
public enum PipelineStage {

    RETAINER_SIGNED("retainer_signed", "Retainer Signed", 7),

    ATTORNEY_REVIEW("attorney_review", "Attorney Review", 8),

    /**
     * Note the EN DASH (U+2013) in the stored label.
     */
    APPROVED_PAYABLE("approved_payable", "Approved – Payable", 9),

    /**
     * Terminal stage: the vendor has been paid.
     */
    PAID_TO_BPO("paid_to_bpo", "Paid to BPO", 10);

    private final String key;
    private final String label;
    private final int displayOrder;

    PipelineStage(String key, String label, int displayOrder) {
        this.key = key;
        this.label = label;
        this.displayOrder = displayOrder;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public int getDisplayOrder() {
        return displayOrder;
    }

    public boolean isTerminal() {
        return this == PAID_TO_BPO;
    }
}
