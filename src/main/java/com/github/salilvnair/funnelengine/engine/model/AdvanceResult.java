package com.github.salilvnair.funnelengine.engine.model;

import com.github.salilvnair.funnelengine.entity.FeConversation;

import java.util.List;

/**
 * Outcome of one {@code advance}. {@code conversation} is a detached working copy; the
 * caller persists it conditionally on {@code fromBlockId} and {@code fromInteractionCount}.
 */
public record AdvanceResult(
        FeConversation conversation,
        String botOutput,
        List<SideEffectRequest> sideEffects,
        AdvanceOutcome outcome,
        String fromBlockId,
        int fromInteractionCount
) {

    public AdvanceResult {
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
    }

    public boolean hasSideEffects() {
        return !sideEffects.isEmpty();
    }
}
