package com.flagship.retainer_settlement.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retainer_settlement.invoice.LineItem;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A line as typed by the author. Incomplete lines are allowed here and dropped during validation;
 * any {@code amount} sent is ignored.
 */
@Value
public class LineItemRequest {

    @JsonProperty("description")
    String description;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("amount")
    BigDecimal amount;

    public LineItem toLineItem() {
        return LineItem.of(description, quantity, unitPrice);
    }
}
