package com.flagship.retainer_settlement.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class NextNumberResponse {

    @JsonProperty("invoice_number")
    String invoiceNumber;
}
