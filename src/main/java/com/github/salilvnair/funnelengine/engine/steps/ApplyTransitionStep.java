package com.github.salilvnair.funnelengine.engine.steps;

import com.github.salilvnair.funnelengine.engine.exception.OrphanedConversationException;
import com.github.salilvnair.funnelengine.engine.model.AdvanceOutcome;
import com.github.salilvnair.funnelengine.engine.model.FunnelInteraction;
import com.github.salilvnair.funnelengine.engine.model.MatchedOption;
import com.github.salilvnair.funnelengine.engine.pipeline.StepResult;
import com.github.salilvnair.funnelengine.engine.pipeline.TransitionStep;
import com.github.salilvnair.funnelengine.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.funnelengine.engine.session.TransitionSession;
import com.github.salilvnair.funnelengine.entity.ConversationStatus;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import org.springframework.stereotype.Component;

@Component
@MustRunAfter(MatchOptionStep.class)
public class ApplyTransitionStep implements TransitionStep {

    @Override
    public StepResult execute(TransitionSession session) {
        FeConversation conversation = session.getConversation();
        FunnelBlock current = session.getCurrentBlock();
        MatchedOption matched = session.getMatchedOption();
        String nextBlockId = matched == null ? null : matched.option().nextBlockId();

        conversation.getInteractions().add(new FunnelInteraction(
                current.id(),
                matched == null ? null : matched.number(),
                matched == null ? null : matched.option().text(),
                session.getRawInput(),
                nextBlockId,
                session.getNow()
        ));
        conversation.setUpdatedAt(session.getNow());

        if (session.getOutcome() == AdvanceOutcome.ADVANCED) {
            // validated graphs never dangle; a miss here means the graph changed underneath us
            FunnelBlock next = session.getGraph()
                    .resolveBlock(nextBlockId)
                    .orElseThrow(() -> new OrphanedConversationException(conversation.getConversationId(), nextBlockId));
            conversation.getUserPath().add(current.id());
            conversation.setCurrentBlockId(next.id());
            session.setNextBlock(next);
        }
        else {
            conversation.setStatus(ConversationStatus.CLOSED);
            conversation.setClosedAt(session.getNow());
        }
        return new StepResult.Continue();
    }
}
