package com.github.salilvnair.funnelengine.engine.phase;

public enum FunnelPhase {
    PHASE1,
    PHASE2,
    TRANSITION,
    COMPLETED;

    public boolean isRePromptable() {
        return this == PHASE1 || this == PHASE2;
    }
}
