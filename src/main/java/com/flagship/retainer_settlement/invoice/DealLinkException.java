package com.flagship.retainer_settlement.invoice;

import java.util.UUID;

/**
 * Linking deals to an invoice updated no rows at all.
 */
public class DealLinkException extends RuntimeException {

    public DealLinkException(UUID invoiceId, int requested) {
        super(String.format("None of the %d deals could be linked to invoice %s", requested, invoiceId));
    }
}
