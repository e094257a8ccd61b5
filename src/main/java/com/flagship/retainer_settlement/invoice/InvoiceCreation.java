package com.flagship.retainer_settlement.invoice;

import lombok.Value;

/**
 * Result of a create call. {@code replayed} is true when the idempotency key had already
 * been used and the earlier invoice is returned instead.
 */
@Value
public class InvoiceCreation {
    Invoice invoice;
    boolean replayed;
}
