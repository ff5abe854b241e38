package com.github.salilvnair.funnelengine.audit;

import com.github.salilvnair.funnelengine.util.JsonUtil;

import java.util.Map;
import java.util.UUID;

public interface AuditService {
    void audit(String stage, UUID conversationId, String payloadJson);

    default void audit(FunnelAuditStage stage, UUID conversationId, String payloadJson) {
        audit(stage.value(), conversationId, payloadJson);
    }

    default void audit(String stage, UUID conversationId, Map<String, ?> payload) {
        audit(stage, conversationId, JsonUtil.toJson(payload == null ? Map.of() : payload));
    }

    default void audit(FunnelAuditStage stage, UUID conversationId, Map<String, ?> payload) {
        audit(stage.value(), conversationId, payload);
    }
}
