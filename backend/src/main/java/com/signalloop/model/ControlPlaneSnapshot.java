package com.signalloop.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Detached, immutable view of a control-plane row, used for before/after
 * reporting and dry runs.
 */
public record ControlPlaneSnapshot(
        Long id,
        OffsetDateTime effectiveAt,
        OffsetDateTime expiresAt,
        double acceptanceThreshold,
        double explorationRate,
        Map<String, Double> templateWeights,
        Map<String, Map<String, Double>> promptVersionWeights,
        String updatedBy,
        String updateReason
) {

    public ControlPlaneSnapshot {
        templateWeights = templateWeights == null ? Map.of() : copyWeights(templateWeights);
        promptVersionWeights = promptVersionWeights == null ? Map.of() : copyNested(promptVersionWeights);
    }

    public static ControlPlaneSnapshot from(ControlPlaneState state) {
        return new ControlPlaneSnapshot(
                state.getId(),
                state.getEffectiveAt(),
                state.getExpiresAt(),
                state.getAcceptanceThreshold(),
                state.getExplorationRate(),
                state.getTemplateWeights(),
                state.getPromptVersionWeights(),
                state.getUpdatedBy(),
                state.getUpdateReason());
    }

    public ControlPlaneState toNewState(OffsetDateTime effectiveAt) {
        ControlPlaneState state = new ControlPlaneState();
        state.setEffectiveAt(effectiveAt);
        state.setAcceptanceThreshold(acceptanceThreshold);
        state.setExplorationRate(explorationRate);
        state.setTemplateWeights(new LinkedHashMap<>(templateWeights));
        Map<String, Map<String, Double>> nested = new LinkedHashMap<>();
        promptVersionWeights.forEach((template, weights) -> nested.put(template, new LinkedHashMap<>(weights)));
        state.setPromptVersionWeights(nested);
        state.setUpdatedBy(updatedBy);
        state.setUpdateReason(updateReason);
        return state;
    }

    private static Map<String, Double> copyWeights(Map<String, Double> weights) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    private static Map<String, Map<String, Double>> copyNested(Map<String, Map<String, Double>> weights) {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        weights.forEach((key, inner) -> copy.put(key, copyWeights(inner == null ? Map.of() : inner)));
        return Collections.unmodifiableMap(copy);
    }
}
