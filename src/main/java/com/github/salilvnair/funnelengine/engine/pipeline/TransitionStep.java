package com.github.salilvnair.funnelengine.engine.pipeline;

import com.github.salilvnair.funnelengine.engine.session.TransitionSession;

public interface TransitionStep {
    StepResult execute(TransitionSession session);
}
