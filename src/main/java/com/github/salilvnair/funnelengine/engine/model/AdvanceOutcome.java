package com.github.salilvnair.funnelengine.engine.model;

public enum AdvanceOutcome {
    /** Option matched, conversation moved to the option's next block. */
    ADVANCED,
    /** Terminal option (or any input at an option-less block); conversation closed. */
    CLOSED,
    /** Nothing matched; current prompt re-rendered, state untouched. */
    INVALID_INPUT,
    /** Conversation was already closed; nothing happened. */
    IGNORED_CLOSED;

    public boolean changesState() {
        return this == ADVANCED || this == CLOSED;
    }
}
