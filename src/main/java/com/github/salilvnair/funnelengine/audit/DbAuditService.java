package com.github.salilvnair.funnelengine.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.entity.FeAudit;
import com.github.salilvnair.funnelengine.repo.AuditRepository;
import com.github.salilvnair.funnelengine.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

@Slf4j
@RequiredArgsConstructor
public class DbAuditService implements AuditService {

    private final AuditRepository auditRepo;
    private final Clock clock;

    @Override
    public void audit(String stage, UUID conversationId, String payloadJson) {
        try {
            OffsetDateTime now = OffsetDateTime.now(clock);
            auditRepo.save(FeAudit.builder()
                    .conversationId(conversationId)
                    .stage(stage)
                    .payloadJson(normalizePayload(stage, conversationId, payloadJson, now))
                    .createdAt(now)
                    .build());
        } catch (Exception e) {
            log.error("Failed to save audit record for conversationId: {} at stage: {}, payload: {}", conversationId, stage, payloadJson, e);
            throw new FunnelEngineException(
                    FunnelEngineErrorCode.AUDIT_WRITE_FAILED,
                    "Failed to save audit record for conversationId: " + conversationId + " at stage: " + stage,
                    e
            );
        }
    }

    private String normalizePayload(String stage, UUID conversationId, String payloadJson, OffsetDateTime now) {
        ObjectNode root = JsonUtil.object();
        JsonNode payloadNode = JsonUtil.parseOrNull(payloadJson);
        if (payloadNode.isObject()) {
            root.setAll((ObjectNode) payloadNode);
        }
        else if (!payloadNode.isNull()) {
            root.set("value", payloadNode);
        }
        else if (payloadJson != null && !payloadJson.isBlank()) {
            root.put("raw_payload", payloadJson);
            root.put("note", "payload_was_not_valid_json");
        }
        ObjectNode meta = root.putObject("_meta");
        meta.put("stage", stage);
        meta.put("conversationId", String.valueOf(conversationId));
        meta.put("emittedAt", now.toString());
        return JsonUtil.toJson(root);
    }
}
