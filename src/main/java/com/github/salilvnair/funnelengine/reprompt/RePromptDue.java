package com.github.salilvnair.funnelengine.reprompt;

import com.github.salilvnair.funnelengine.engine.phase.FunnelPhase;

public record RePromptDue(FunnelPhase phase, int offsetMinutes, String message) {

    /**
     * Slot identifier stored on the conversation once this re-prompt has been sent.
     */
    public String key() {
        return phase.name() + ":" + offsetMinutes;
    }
}
