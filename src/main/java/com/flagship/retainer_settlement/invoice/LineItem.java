package com.flagship.retainer_settlement.invoice;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One billed line. {@code amount} is always recomputed from quantity and unit price
 * before an invoice is stored.
 */
@Value
public class LineItem {

    @JsonProperty("description")
    String description;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("amount")
    BigDecimal amount;

    public static LineItem of(String description, BigDecimal quantity, BigDecimal unitPrice) {
        return new LineItem(description, quantity, unitPrice, null);
    }
}
