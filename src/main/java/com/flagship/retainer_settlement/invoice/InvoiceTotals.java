package com.flagship.retainer_settlement.invoice;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class InvoiceTotals {
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal totalAmount;
}
