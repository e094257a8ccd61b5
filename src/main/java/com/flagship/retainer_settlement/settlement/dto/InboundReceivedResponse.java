package com.flagship.retainer_settlement.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * {@code applied} is false when the deal was not eligible; the entry is returned unchanged in that case.
 */
@Value
public class InboundReceivedResponse {

    @JsonProperty("applied")
    boolean applied;

    @JsonProperty("settlement")
    SettlementView settlement;
}
