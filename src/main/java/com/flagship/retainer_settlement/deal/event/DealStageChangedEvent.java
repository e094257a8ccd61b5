package com.flagship.retainer_settlement.deal.event;

import com.flagship.retainer_settlement.pipeline.PipelineStage;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A deal moved to another settlement stage and the move was persisted.
 */
@Value
public class DealStageChangedEvent implements DealEvent {
    UUID eventId;
    UUID dealId;
    String previousStage;
    String newStage;
    boolean settled;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DealStageChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DealStageChangedEvent of(UUID dealId, PipelineStage from, PipelineStage to) {
        return fromStatus(dealId, from == null ? null : from.getLabel(), to);
    }

    /**
     * For deals whose previous status may lie outside the settlement stages.
     */
    public static DealStageChangedEvent fromStatus(UUID dealId, String previousStatus, PipelineStage to) {
        return new DealStageChangedEvent(
            UUID.randomUUID(),
            dealId,
            previousStatus,
            to.getLabel(),
            to.isTerminal(),
            Instant.now()
        );
    }
}
