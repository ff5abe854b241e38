package com.github.salilvnair.funnelengine.service;

import com.github.salilvnair.funnelengine.engine.model.AdvanceOutcome;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.guard.GuardResult;

import java.util.List;

/**
 * What one inbound event produced: the persisted conversation, the reply to show (may be
 * {@code null}) and the outcome of any one-time action that was attempted.
 */
public record ConversationTurn(
        FeConversation conversation,
        String botOutput,
        AdvanceOutcome outcome,
        List<GuardResult> sideEffects
) {

    public ConversationTurn {
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
    }
}
