package com.flagship.retainer_settlement.settlement;

/**
 * The store rejected a stage change. The ledger has already been rolled back when this is thrown.
 */
public class StageTransitionFailedException extends RuntimeException {

    public StageTransitionFailedException(String transition, Throwable cause) {
        super(transition + " failed: " + cause.getMessage(), cause);
    }
}
