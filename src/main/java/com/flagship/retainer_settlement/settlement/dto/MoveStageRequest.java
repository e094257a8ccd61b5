package com.flagship.retainer_settlement.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Target column of a kanban move, given as the stage label (e.g. "Attorney Review").
 */
@Value
public class MoveStageRequest {

    @NotBlank(message = "Target stage is required")
    @JsonProperty("stage")
    String stage;
}
