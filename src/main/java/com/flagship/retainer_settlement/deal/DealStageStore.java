package com.flagship.retainer_settlement.deal;

import com.flagship.retainer_settlement.pipeline.PipelineStage;

import java.util.UUID;

/**
 * Persistence boundary for pipeline stage changes.
 *
 * Implementations either durably store the new stage or throw; the settlement ledger relies on
 * the exception to roll back its optimistic view.
 */
public interface DealStageStore {

    /**
     * Persists {@code to} as the deal's status.
     *
     * @param dealId deal to update
     * @param from stage the caller believes the deal is in, recorded on the emitted event
     * @param to new stage
     * @throws DealNotFoundException if no row was updated
     */
    void updateStage(UUID dealId, PipelineStage from, PipelineStage to);
}
