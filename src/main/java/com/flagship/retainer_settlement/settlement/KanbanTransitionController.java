package com.flagship.retainer_settlement.settlement;

import com.flagship.retainer_settlement.observability.CorrelationContext;
import com.flagship.retainer_settlement.observability.SettlementMetrics;
import com.flagship.retainer_settlement.pipeline.PipelineStage;
import com.flagship.retainer_settlement.pipeline.StageRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.context.annotation.SessionScope;

import java.util.UUID;

/**
 * Turns kanban card drags into stage changes.
 *
 * One drag is active per session. Dropping a card on its own column is a no-op; dropping it on
 * another column runs an optimistic stage change against the ledger. Dropping on "Paid to BPO"
 * goes through {@link SettlementLedger#payOutbound(UUID)} so the safety lock is always checked.
 *
 * The drag ends as soon as a drop is accepted, so other cards can be moved while the save
 * runs. Changes for the same deal are serialized by the ledger.
 */
@Component
@SessionScope
@Slf4j
public class KanbanTransitionController {

    private final SettlementLedger ledger;
    private final SettlementMetrics metrics;

    private DragState dragState = DragState.IDLE;
    private UUID draggedDealId;

    public KanbanTransitionController(SettlementLedger ledger, SettlementMetrics metrics) {
        this.ledger = ledger;
        this.metrics = metrics;
    }

    /**
     * @throws TransitionInProgressException if another drag is active or the deal has a change in flight
     * @throws com.flagship.retainer_settlement.deal.DealNotFoundException if the deal is not in the working set
     */
    public synchronized void beginDrag(UUID dealId) {
        ledger.get(dealId);
        if (dragState != DragState.IDLE || ledger.isInFlight(dealId)) {
            throw new TransitionInProgressException(dealId);
        }
        dragState = DragState.DRAGGING;
        draggedDealId = dealId;
    }

    public synchronized void cancelDrag() {
        resetDrag();
    }

    public synchronized DragState getDragState() {
        return dragState;
    }

    /**
     * Ends the active drag on the column labelled {@code targetLabel}.
     *
     * @throws IllegalStateException if no drag is active, or the card is in the terminal stage
     * @throws IllegalArgumentException if the label is not a settlement stage
     * @throws SafetyLockException if the target is "Paid to BPO" and the deal may not be paid yet
     * @throws TransitionInProgressException if the deal has another change in flight
     * @throws StageTransitionFailedException if persistence failed; the card is back in its column
     */
    public TransitionOutcome drop(String targetLabel) {
        UUID dealId;
        PipelineStage target;
        SettlementEntry entry;
        synchronized (this) {
            if (dragState != DragState.DRAGGING) {
                throw new IllegalStateException("No card is being dragged");
            }
            dealId = draggedDealId;
            try {
                target = StageRegistry.fromLabel(targetLabel)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + targetLabel));
                entry = ledger.get(dealId);
                if (entry.getStage() == target) {
                    dragState = DragState.DROPPED_SAME_COLUMN;
                    resetDrag();
                    return TransitionOutcome.NO_OP_SAME_COLUMN;
                }
                if (entry.getStage().isTerminal()) {
                    throw new IllegalStateException(String.format(
                        "Deal %s is in terminal stage '%s' and cannot be moved", dealId, entry.getStage().getLabel()));
                }
            } catch (RuntimeException e) {
                resetDrag();
                throw e;
            }
            dragState = DragState.DROPPED_OTHER_COLUMN;
            resetDrag();
        }

        MDC.put(CorrelationContext.DEAL_ID_MDC_KEY, dealId.toString());
        try {
            transition(entry, target);
            metrics.recordTransition("committed", target.getKey());
            log.info("Moved deal from '{}' to '{}'", entry.getStage().getLabel(), target.getLabel());
            return TransitionOutcome.COMMITTED;
        } catch (StageTransitionFailedException e) {
            metrics.recordTransition("rolled_back", target.getKey());
            log.error("Stage change rolled back: {}", e.getMessage());
            throw e;
        } catch (SafetyLockException | TransitionInProgressException e) {
            metrics.recordTransition("rejected", target.getKey());
            log.warn("Stage change rejected: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.DEAL_ID_MDC_KEY);
        }
    }

    /**
     * Drag and drop in one call.
     */
    public TransitionOutcome move(UUID dealId, String targetLabel) {
        beginDrag(dealId);
        return drop(targetLabel);
    }

    private void transition(SettlementEntry entry, PipelineStage target) {
        if (target == PipelineStage.PAID_TO_BPO) {
            ledger.payOutbound(entry.getDealId());
            return;
        }
        long startTime = System.currentTimeMillis();
        ledger.changeStage(entry, target);
        metrics.recordPersistenceLatency("update_stage", System.currentTimeMillis() - startTime);
    }

    private void resetDrag() {
        dragState = DragState.IDLE;
        draggedDealId = null;
    }
}
