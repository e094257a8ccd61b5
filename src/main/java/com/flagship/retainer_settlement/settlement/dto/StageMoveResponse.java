package com.flagship.retainer_settlement.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retainer_settlement.settlement.TransitionOutcome;
import lombok.Value;

@Value
public class StageMoveResponse {

    @JsonProperty("outcome")
    TransitionOutcome outcome;

    @JsonProperty("settlement")
    SettlementView settlement;
}
