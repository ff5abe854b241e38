package com.github.salilvnair.funnelengine.api.dto;

import com.github.salilvnair.funnelengine.entity.FeConversation;
import lombok.Data;

import java.util.List;

@Data
public class ConversationResponse {

    private boolean success;
    private String conversationId;
    private String funnelId;
    private String status;
    private String currentBlockId;
    private List<String> userPath;
    private String outcome;
    private String reply;
    private List<SideEffectOutcome> sideEffects;
    private String errorCode;
    private String errorMessage;
    private boolean recoverable;

    public record SideEffectOutcome(String actionKey, String outcome, String error) {}

    public static ConversationResponse of(FeConversation conversation) {
        ConversationResponse res = new ConversationResponse();
        res.setSuccess(true);
        res.setConversationId(String.valueOf(conversation.getConversationId()));
        res.setFunnelId(conversation.getFunnelId());
        res.setStatus(conversation.getStatus() == null ? null : conversation.getStatus().name());
        res.setCurrentBlockId(conversation.getCurrentBlockId());
        res.setUserPath(conversation.getUserPath());
        return res;
    }

    public static ConversationResponse error(String conversationId, String errorCode, String errorMessage, boolean recoverable) {
        ConversationResponse res = new ConversationResponse();
        res.setSuccess(false);
        res.setConversationId(conversationId);
        res.setErrorCode(errorCode);
        res.setErrorMessage(errorMessage);
        res.setRecoverable(recoverable);
        return res;
    }
}
