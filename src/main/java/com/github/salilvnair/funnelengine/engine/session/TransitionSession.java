package com.github.salilvnair.funnelengine.engine.session;

import com.github.salilvnair.funnelengine.engine.model.AdvanceOutcome;
import com.github.salilvnair.funnelengine.engine.model.AdvanceResult;
import com.github.salilvnair.funnelengine.engine.model.MatchedOption;
import com.github.salilvnair.funnelengine.engine.model.SideEffectRequest;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * State carried through one run of the transition pipeline. Steps only ever mutate
 * {@link #conversation}, which is a copy of the caller's record.
 */
@Getter
@Setter
public class TransitionSession {

    private final FunnelGraph graph;
    private final FeConversation conversation;
    private final String rawInput;
    private final OffsetDateTime now;
    private final String fromBlockId;
    private final int fromInteractionCount;

    private FunnelBlock currentBlock;
    private MatchedOption matchedOption;
    private FunnelBlock nextBlock;
    private AdvanceOutcome outcome;
    private String botOutput;
    private final List<SideEffectRequest> sideEffects = new ArrayList<>();
    private AdvanceResult finalResult;

    public TransitionSession(FunnelGraph graph, FeConversation original, String rawInput, OffsetDateTime now) {
        this.graph = graph;
        this.conversation = original.copy();
        this.rawInput = rawInput;
        this.now = now;
        this.fromBlockId = original.getCurrentBlockId();
        this.fromInteractionCount = original.getInteractions() == null ? 0 : original.getInteractions().size();
    }

    public UUID getConversationId() {
        return conversation.getConversationId();
    }

    /**
     * Block whose prompt is shown after this transition: the next block when the conversation
     * moved, otherwise the current one.
     */
    public FunnelBlock getDisplayBlock() {
        return nextBlock != null ? nextBlock : currentBlock;
    }

    public AdvanceResult toResult() {
        return new AdvanceResult(conversation, botOutput, sideEffects, outcome, fromBlockId, fromInteractionCount);
    }
}
