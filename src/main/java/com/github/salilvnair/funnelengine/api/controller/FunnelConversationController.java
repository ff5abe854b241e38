package com.github.salilvnair.funnelengine.api.controller;

import com.github.salilvnair.funnelengine.api.dto.ConversationMessageRequest;
import com.github.salilvnair.funnelengine.api.dto.ConversationResponse;
import com.github.salilvnair.funnelengine.api.dto.StartConversationRequest;
import com.github.salilvnair.funnelengine.audit.AuditService;
import com.github.salilvnair.funnelengine.audit.FunnelAuditStage;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.service.ConversationTurn;
import com.github.salilvnair.funnelengine.service.FunnelConversationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/funnel/conversations")
@RequiredArgsConstructor
public class FunnelConversationController {

    private final FunnelConversationService conversationService;
    private final AuditService audit;

    @PostMapping
    public ConversationResponse start(@Valid @RequestBody StartConversationRequest request) {
        try {
            return toResponse(conversationService.start(request.getFunnelId(), request.getScope(), request.getTargetUserRef()));
        }
        catch (FunnelEngineException ex) {
            log.warn("Start failed for funnel {}: {} {}", request.getFunnelId(), ex.getErrorCode(), ex.getMessage());
            return ConversationResponse.error(null, ex.getErrorCode(), ex.getMessage(), ex.isRecoverable());
        }
    }

    @PostMapping("/{conversationId}/messages")
    public ConversationResponse message(@PathVariable("conversationId") UUID conversationId,
                                        @Valid @RequestBody ConversationMessageRequest request) {
        try {
            return toResponse(conversationService.handleInput(conversationId, request.getMessage()));
        }
        catch (FunnelEngineException ex) {
            log.warn("Input failed for convId={}: {} {}", conversationId, ex.getErrorCode(), ex.getMessage());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("errorCode", ex.getErrorCode());
            payload.put("message", ex.getMessage());
            payload.put("recoverable", ex.isRecoverable());
            audit.audit(FunnelAuditStage.ENGINE_KNOWN_FAILURE, conversationId, payload);
            return ConversationResponse.error(conversationId.toString(), ex.getErrorCode(), ex.getMessage(), ex.isRecoverable());
        }
        catch (Exception ex) {
            log.error("Unexpected failure for convId={}", conversationId, ex);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("exception", String.valueOf(ex));
            payload.put("message", ex.getMessage());
            payload.put("recoverable", false);
            audit.audit(FunnelAuditStage.ENGINE_UNKNOWN_FAILURE, conversationId, payload);
            return ConversationResponse.error(conversationId.toString(), null, ex.getMessage(), false);
        }
    }

    @GetMapping("/{conversationId}")
    public ConversationResponse get(@PathVariable("conversationId") UUID conversationId) {
        try {
            return ConversationResponse.of(conversationService.get(conversationId));
        }
        catch (FunnelEngineException ex) {
            return ConversationResponse.error(conversationId.toString(), ex.getErrorCode(), ex.getMessage(), ex.isRecoverable());
        }
    }

    private ConversationResponse toResponse(ConversationTurn turn) {
        ConversationResponse res = ConversationResponse.of(turn.conversation());
        res.setOutcome(turn.outcome().name());
        res.setReply(turn.botOutput());
        res.setSideEffects(turn.sideEffects().stream()
                .map(g -> new ConversationResponse.SideEffectOutcome(g.actionKey(), g.outcome().name(), g.error()))
                .toList());
        return res;
    }
}
