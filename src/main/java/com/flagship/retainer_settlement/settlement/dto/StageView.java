package com.flagship.retainer_settlement.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retainer_settlement.pipeline.PipelineStage;
import lombok.Value;

@Value
public class StageView {

    @JsonProperty("key")
    String key;

    @JsonProperty("label")
    String label;

    @JsonProperty("display_order")
    int displayOrder;

    @JsonProperty("terminal")
    boolean terminal;

    public static StageView from(PipelineStage stage) {
        return new StageView(stage.getKey(), stage.getLabel(), stage.getDisplayOrder(), stage.isTerminal());
    }
}
