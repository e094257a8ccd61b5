package com.flagship.retainer_settlement.invoice;

/**
 * The invoice's status does not allow the requested operation.
 */
public class InvoiceStateException extends IllegalStateException {

    public InvoiceStateException(String message) {
        super(message);
    }
}
