package com.flagship.retainer_settlement.settlement;

import java.util.UUID;

/**
 * A second stage change for a deal arrived while the first was still being persisted.
 */
public class TransitionInProgressException extends RuntimeException {

    public TransitionInProgressException(UUID dealId) {
        super("A stage change for deal " + dealId + " is still in progress");
    }
}
