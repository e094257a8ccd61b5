package com.flagship.retainer_settlement.settlement;

import java.util.UUID;

/**
 * Outbound payment was requested for a deal that is not eligible: inbound not yet received,
 * or already paid.
 */
public class SafetyLockException extends RuntimeException {

    public SafetyLockException(UUID dealId, String reason) {
        super(String.format("Cannot pay BPO for deal %s: %s", dealId, reason));
    }
}
