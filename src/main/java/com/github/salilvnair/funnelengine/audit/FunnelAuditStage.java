package com.github.salilvnair.funnelengine.audit;

public enum FunnelAuditStage {
    CONVERSATION_STARTED,
    INPUT_ACCEPTED,
    INPUT_REJECTED,
    INPUT_IGNORED,
    STALE_TRANSITION,
    CONVERSATION_CLOSED,
    ACTION_CLAIMED,
    ACTION_SKIPPED,
    ACTION_FIRED,
    ACTION_RELEASED,
    ACTION_TIMED_OUT,
    ACTION_BOOKKEEPING_FAILED,
    REPROMPT_SENT,
    REPROMPT_FAILED,
    CONVERSATION_REAPED,
    ENGINE_KNOWN_FAILURE,
    ENGINE_UNKNOWN_FAILURE;

    public String value() {
        return name();
    }
}
