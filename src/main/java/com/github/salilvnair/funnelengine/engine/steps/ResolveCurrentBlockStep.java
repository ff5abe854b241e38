package com.github.salilvnair.funnelengine.engine.steps;

import com.github.salilvnair.funnelengine.engine.exception.OrphanedConversationException;
import com.github.salilvnair.funnelengine.engine.model.AdvanceOutcome;
import com.github.salilvnair.funnelengine.engine.pipeline.StepResult;
import com.github.salilvnair.funnelengine.engine.pipeline.TransitionStep;
import com.github.salilvnair.funnelengine.engine.session.TransitionSession;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ResolveCurrentBlockStep implements TransitionStep {

    @Override
    public StepResult execute(TransitionSession session) {
        FeConversation conversation = session.getConversation();
        if (!conversation.isActive()) {
            log.debug("Ignoring input for closed conversation {}", conversation.getConversationId());
            session.setOutcome(AdvanceOutcome.IGNORED_CLOSED);
            return new StepResult.Stop(session.toResult());
        }
        FunnelBlock block = session.getGraph()
                .resolveBlock(conversation.getCurrentBlockId())
                .orElseThrow(() -> new OrphanedConversationException(
                        conversation.getConversationId(), conversation.getCurrentBlockId()));
        session.setCurrentBlock(block);
        return new StepResult.Continue();
    }
}
