package com.github.salilvnair.funnelengine.engine.steps;

import com.github.salilvnair.funnelengine.action.AffiliateDmAction;
import com.github.salilvnair.funnelengine.engine.model.AdvanceOutcome;
import com.github.salilvnair.funnelengine.engine.model.SideEffectRequest;
import com.github.salilvnair.funnelengine.engine.phase.TriggerStagePolicy;
import com.github.salilvnair.funnelengine.engine.pipeline.StepResult;
import com.github.salilvnair.funnelengine.engine.pipeline.TransitionStep;
import com.github.salilvnair.funnelengine.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.funnelengine.engine.session.TransitionSession;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
@TerminalStep
public class TriggerStageStep implements TransitionStep {

    private final TriggerStagePolicy triggerStagePolicy;

    @Override
    public StepResult execute(TransitionSession session) {
        FunnelBlock next = session.getNextBlock();
        if (session.getOutcome() == AdvanceOutcome.ADVANCED
                && next != null
                && !session.getConversation().isOneTimeActionClaimed()
                && triggerStagePolicy.isTriggerBlock(session.getGraph(), next.id())) {
            log.debug("Block {} is in a trigger stage, requesting {} convId={}",
                    next.id(), AffiliateDmAction.ACTION_KEY, session.getConversationId());
            session.getSideEffects().add(new SideEffectRequest(
                    session.getConversationId(),
                    AffiliateDmAction.ACTION_KEY,
                    next.id(),
                    next.resourceName()
            ));
        }
        session.setFinalResult(session.toResult());
        return new StepResult.Continue();
    }
}
