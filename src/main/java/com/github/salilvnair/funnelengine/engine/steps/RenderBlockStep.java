package com.github.salilvnair.funnelengine.engine.steps;

import com.github.salilvnair.funnelengine.engine.pipeline.StepResult;
import com.github.salilvnair.funnelengine.engine.pipeline.TransitionStep;
import com.github.salilvnair.funnelengine.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.funnelengine.engine.render.BlockRenderer;
import com.github.salilvnair.funnelengine.engine.session.TransitionSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
@MustRunAfter(ApplyTransitionStep.class)
public class RenderBlockStep implements TransitionStep {

    private final BlockRenderer blockRenderer;

    @Override
    public StepResult execute(TransitionSession session) {
        // closing transitions have nothing left to show
        if (session.getNextBlock() != null) {
            session.setBotOutput(blockRenderer.render(session.getNextBlock(), session.getConversation()));
        }
        return new StepResult.Continue();
    }
}
