package com.flagship.retainer_settlement.settlement;

/**
 * An optimistic stage change: applied locally first, then committed to the store,
 * or rolled back if the store refuses.
 */
public interface StageTransitionCommand {

    /**
     * Updates the local view. Must not touch persistence.
     */
    void apply();

    /**
     * Persists the change. Throws if the store rejects it.
     */
    void commit();

    /**
     * Restores the local view captured before {@link #apply()}.
     */
    void rollback();

    /**
     * Runs apply, commit and, on a failed commit, rollback.
     *
     * @throws StageTransitionFailedException wrapping the store's failure, after the rollback
     */
    default void execute() {
        apply();
        try {
            commit();
        } catch (RuntimeException e) {
            rollback();
            throw new StageTransitionFailedException(describe(), e);
        }
    }

    String describe();
}
