package com.github.salilvnair.funnelengine.engine.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class OrphanedConversationException extends FunnelEngineException {

    private final UUID conversationId;
    private final String blockId;

    public OrphanedConversationException(UUID conversationId, String blockId) {
        super(FunnelEngineErrorCode.ORPHANED_CONVERSATION,
                "Conversation " + conversationId + " points at unknown block '" + blockId + "'");
        this.conversationId = conversationId;
        this.blockId = blockId;
    }
}
