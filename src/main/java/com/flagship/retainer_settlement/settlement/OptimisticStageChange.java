package com.flagship.retainer_settlement.settlement;

import com.flagship.retainer_settlement.deal.DealStageStore;
import com.flagship.retainer_settlement.pipeline.PaymentState;
import com.flagship.retainer_settlement.pipeline.PipelineStage;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves one ledger entry to a new stage ahead of the store's confirmation.
 *
 * Apply only succeeds if the ledger still holds the entry the change was prepared from.
 * Rollback puts that entry back, stage and payment state together, unless the ledger has
 * moved on since (a reload, for instance).
 */
@Slf4j
class OptimisticStageChange implements StageTransitionCommand {

    private final SettlementLedger ledger;
    private final DealStageStore store;
    private final SettlementEntry original;
    private final SettlementEntry moved;
    private final PipelineStage targetStage;

    OptimisticStageChange(SettlementLedger ledger, DealStageStore store, SettlementEntry original,
                          PipelineStage targetStage, PaymentState targetPaymentState) {
        this.ledger = ledger;
        this.store = store;
        this.original = original;
        this.moved = original.movedTo(targetStage, targetPaymentState);
        this.targetStage = targetStage;
    }

    /**
     * @throws IllegalStateException if the entry changed after this move was prepared
     */
    @Override
    public void apply() {
        if (!ledger.swap(original, moved)) {
            throw new IllegalStateException(String.format(
                "Deal %s changed while the move was being prepared", original.getDealId()));
        }
    }

    @Override
    public void commit() {
        store.updateStage(original.getDealId(), original.getStage(), targetStage);
    }

    @Override
    public void rollback() {
        if (!ledger.swap(moved, original)) {
            log.warn("Deal {} was replaced during a failed move; keeping the newer entry", original.getDealId());
        }
    }

    @Override
    public String describe() {
        return String.format("Move deal %s from '%s' to '%s'",
                original.getDealId(), original.getStage().getLabel(), targetStage.getLabel());
    }
}
