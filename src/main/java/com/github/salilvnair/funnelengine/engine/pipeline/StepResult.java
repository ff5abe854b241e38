package com.github.salilvnair.funnelengine.engine.pipeline;

import com.github.salilvnair.funnelengine.engine.model.AdvanceResult;

public sealed interface StepResult permits StepResult.Continue, StepResult.Stop {

    record Continue() implements StepResult {}
    record Stop(AdvanceResult result) implements StepResult {}
}
