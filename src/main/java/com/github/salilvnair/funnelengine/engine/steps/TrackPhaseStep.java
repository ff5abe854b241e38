package com.github.salilvnair.funnelengine.engine.steps;

import com.github.salilvnair.funnelengine.engine.model.AdvanceOutcome;
import com.github.salilvnair.funnelengine.engine.phase.FunnelPhase;
import com.github.salilvnair.funnelengine.engine.phase.PhaseDetector;
import com.github.salilvnair.funnelengine.engine.pipeline.StepResult;
import com.github.salilvnair.funnelengine.engine.pipeline.TransitionStep;
import com.github.salilvnair.funnelengine.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.funnelengine.engine.pipeline.annotation.MustRunBefore;
import com.github.salilvnair.funnelengine.engine.session.TransitionSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Stamps {@code phaseStartTime} when a conversation crosses from phase 1 into phase 2; that
 * timestamp anchors the phase-2 re-prompt offsets.
 */
@RequiredArgsConstructor
@Component
@MustRunAfter(ApplyTransitionStep.class)
@MustRunBefore(RenderBlockStep.class)
public class TrackPhaseStep implements TransitionStep {

    private final PhaseDetector phaseDetector;

    @Override
    public StepResult execute(TransitionSession session) {
        if (session.getOutcome() != AdvanceOutcome.ADVANCED) {
            return new StepResult.Continue();
        }
        FunnelPhase from = phaseDetector.phaseOf(session.getGraph(), session.getFromBlockId());
        FunnelPhase to = phaseDetector.phaseOf(session.getGraph(), session.getNextBlock().id());
        if (from == FunnelPhase.PHASE1 && to == FunnelPhase.PHASE2) {
            session.getConversation().setPhaseStartTime(session.getNow());
        }
        return new StepResult.Continue();
    }
}
