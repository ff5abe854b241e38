package com.github.salilvnair.funnelengine.engine.pipeline;

import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.engine.model.AdvanceResult;
import com.github.salilvnair.funnelengine.engine.session.TransitionSession;

import java.util.List;

public final class TransitionPipeline {

    private final List<TransitionStep> steps;

    public TransitionPipeline(List<TransitionStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public List<TransitionStep> steps() {
        return steps;
    }

    public AdvanceResult execute(TransitionSession session) {
        for (TransitionStep step : steps) {
            StepResult r = step.execute(session);
            if (r instanceof StepResult.Stop stop) {
                return stop.result();
            }
        }
        // the @TerminalStep must have set finalResult
        if (session.getFinalResult() == null) {
            throw new FunnelEngineException(
                    FunnelEngineErrorCode.PIPELINE_NO_FINAL_RESULT
            );
        }
        return session.getFinalResult();
    }
}
