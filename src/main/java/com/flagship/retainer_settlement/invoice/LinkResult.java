package com.flagship.retainer_settlement.invoice;

import lombok.Value;

@Value
public class LinkResult {
    int requested;
    int linked;

    public static LinkResult empty() {
        return new LinkResult(0, 0);
    }

    /**
     * Some, but not all, requested deals were linked.
     */
    public boolean isPartial() {
        return linked > 0 && linked < requested;
    }
}
