package com.flagship.retainer_settlement.deal;

import java.util.UUID;

public class DealNotFoundException extends RuntimeException {

    public DealNotFoundException(UUID dealId) {
        super("Deal not found: " + dealId);
    }
}
