package com.github.salilvnair.funnelengine.engine.core;

import com.github.salilvnair.funnelengine.engine.model.AdvanceResult;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;

public interface FunnelEngine {

    /**
     * Computes the next state of {@code conversation} for {@code rawInput}. The passed record is
     * never mutated and nothing is persisted; the result carries a working copy.
     *
     * @throws com.github.salilvnair.funnelengine.engine.exception.OrphanedConversationException
     *         when the conversation points at a block that is not in {@code graph}
     */
    AdvanceResult advance(FunnelGraph graph, FeConversation conversation, String rawInput);
}
