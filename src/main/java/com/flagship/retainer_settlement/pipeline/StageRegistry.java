package com.flagship.retainer_settlement.pipeline;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Static lookup over the settlement pipeline stages.
 */
public final class StageRegistry {

    private static final List<PipelineStage> ORDERED = Arrays.stream(PipelineStage.values())
            .sorted(Comparator.comparingInt(PipelineStage::getDisplayOrder))
            .toList();

    private static final Map<String, PipelineStage> BY_LABEL = ORDERED.stream()
            .collect(Collectors.toUnmodifiableMap(PipelineStage::getLabel, Function.identity()));

    private StageRegistry() {
        // Utility class
    }

    /**
     * All settlement stages, ordered by display order.
     */
    public static List<PipelineStage> stages() {
        return ORDERED;
    }

    public static String labelOf(PipelineStage stage) {
        return stage.getLabel();
    }

    public static OptionalInt orderOf(String label) {
        PipelineStage stage = label == null ? null : BY_LABEL.get(label);
        return stage == null ? OptionalInt.empty() : OptionalInt.of(stage.getDisplayOrder());
    }

    /**
     * Resolves a stored status label. Matching is exact, including the dash in "Approved – Payable".
     */
    public static Optional<PipelineStage> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    public static boolean isRegistered(String label) {
        return fromLabel(label).isPresent();
    }

    /**
     * The status labels that place a deal in the settlement working set.
     */
    public static List<String> settlementLabels() {
        return ORDERED.stream().map(PipelineStage::getLabel).toList();
    }
}
