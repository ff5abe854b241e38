package com.github.salilvnair.funnelengine.engine.exception;

public enum FunnelEngineErrorCode {

    // =========================
    // Graph errors
    // =========================
    GRAPH_INTEGRITY_VIOLATION(
            "Funnel graph failed integrity validation",
            false
    ),

    GRAPH_DOCUMENT_UNREADABLE(
            "Funnel graph document could not be parsed",
            false
    ),

    FUNNEL_NOT_FOUND(
            "No published funnel found for the given id",
            false
    ),

    // =========================
    // Conversation errors
    // =========================
    CONVERSATION_NOT_FOUND(
            "Conversation not found",
            false
    ),

    ORPHANED_CONVERSATION(
            "Conversation points at a block that is not in the funnel graph",
            false
    ),

    STALE_TRANSITION(
            "Conversation moved on before this transition could be applied",
            true
    ),

    CONVERSATION_PERSIST_FAILED(
            "Failed to persist conversation state",
            true
    ),

    // =========================
    // Side effects / scheduling
    // =========================
    DELIVERY_FAILED(
            "Message delivery failed",
            true
    ),

    ACTION_NOT_REGISTERED(
            "No one-time action registered for the requested key",
            false
    ),

    REPROMPT_MESSAGE_MISSING(
            "No re-prompt message configured for phase and offset",
            false
    ),

    // =========================
    // Engine / pipeline errors
    // =========================
    PIPELINE_CONSTRAINT_VIOLATION(
            "Transition pipeline ordering constraints violated",
            false
    ),

    DUPLICATE_TRANSITION_STEP(
            "Duplicate TransitionStep bean detected",
            false
    ),

    PIPELINE_NO_FINAL_RESULT(
            "Transition pipeline completed without producing a result",
            false
    ),

    AUDIT_WRITE_FAILED(
            "Failed to write audit entry",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal engine error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    FunnelEngineErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
