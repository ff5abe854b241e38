package com.github.salilvnair.funnelengine.service;

import com.github.salilvnair.funnelengine.audit.AuditService;
import com.github.salilvnair.funnelengine.audit.FunnelAuditStage;
import com.github.salilvnair.funnelengine.action.AffiliateDmAction;
import com.github.salilvnair.funnelengine.engine.core.FunnelEngine;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.engine.model.AdvanceOutcome;
import com.github.salilvnair.funnelengine.engine.model.AdvanceResult;
import com.github.salilvnair.funnelengine.engine.model.SideEffectRequest;
import com.github.salilvnair.funnelengine.engine.phase.TriggerStagePolicy;
import com.github.salilvnair.funnelengine.engine.render.BlockRenderer;
import com.github.salilvnair.funnelengine.entity.ConversationStatus;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.entity.MessageRole;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import com.github.salilvnair.funnelengine.guard.GuardResult;
import com.github.salilvnair.funnelengine.guard.SideEffectGuard;
import com.github.salilvnair.funnelengine.spi.ConversationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for inbound events. Loads state, runs the transition engine, persists the result
 * conditionally on the conversation not having moved meanwhile, and hands side-effect requests
 * to the guard.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class FunnelConversationService {

    private final FunnelGraphRegistry graphRegistry;
    private final FunnelEngine engine;
    private final BlockRenderer blockRenderer;
    private final TriggerStagePolicy triggerStagePolicy;
    private final ConversationStore conversationStore;
    private final SideEffectGuard sideEffectGuard;
    private final AuditService audit;
    private final Clock clock;

    public ConversationTurn start(String funnelId, String scope, String targetUserRef) {
        PublishedFunnel funnel = graphRegistry.graphFor(funnelId);
        FunnelGraph graph = funnel.graph();
        OffsetDateTime now = OffsetDateTime.now(clock);

        FeConversation conversation = FeConversation.builder()
                .conversationId(UUID.randomUUID())
                .funnelId(funnelId)
                .scope(scope != null && !scope.isBlank() ? scope : funnel.scope())
                .targetUserRef(targetUserRef)
                .status(ConversationStatus.ACTIVE)
                .currentBlockId(graph.startBlockId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        FunnelBlock start = graph.startBlock();
        String welcome = blockRenderer.render(start, conversation);

        FeConversation created = conversationStore.create(conversation);
        conversationStore.appendMessage(created.getConversationId(), MessageRole.BOT, welcome, now);
        log.info("Started conversation {} on funnel {} for user {}", created.getConversationId(), funnelId, targetUserRef);
        audit.audit(FunnelAuditStage.CONVERSATION_STARTED, created.getConversationId(),
                Map.of("funnelId", funnelId, "startBlockId", graph.startBlockId()));

        List<SideEffectRequest> requests = new ArrayList<>();
        if (triggerStagePolicy.isTriggerBlock(graph, start.id())) {
            requests.add(new SideEffectRequest(created.getConversationId(), AffiliateDmAction.ACTION_KEY,
                    start.id(), start.resourceName()));
        }
        List<GuardResult> fired = runSideEffects(requests);
        return new ConversationTurn(reload(created), welcome, AdvanceOutcome.ADVANCED, fired);
    }

    public ConversationTurn handleInput(UUID conversationId, String rawInput) {
        FeConversation conversation = get(conversationId);
        FunnelGraph graph = graphRegistry.graphFor(conversation.getFunnelId()).graph();
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (conversation.isActive()) {
            conversationStore.appendMessage(conversationId, MessageRole.USER, rawInput, now);
        }

        AdvanceResult result = engine.advance(graph, conversation, rawInput);
        switch (result.outcome()) {
            case IGNORED_CLOSED -> {
                audit.audit(FunnelAuditStage.INPUT_IGNORED, conversationId, Map.of("reason", "conversation closed"));
                return new ConversationTurn(conversation, null, result.outcome(), List.of());
            }
            case INVALID_INPUT -> {
                log.debug("Invalid input for convId={} at block {}", conversationId, result.fromBlockId());
                conversationStore.appendMessage(conversationId, MessageRole.BOT, result.botOutput(), now);
                audit.audit(FunnelAuditStage.INPUT_REJECTED, conversationId, Map.of("blockId", result.fromBlockId()));
                return new ConversationTurn(reload(conversation), result.botOutput(), result.outcome(), List.of());
            }
            default -> {
                return applyTransition(conversationId, result, now);
            }
        }
    }

    public FeConversation get(UUID conversationId) {
        return conversationStore.load(conversationId)
                .orElseThrow(() -> new FunnelEngineException(FunnelEngineErrorCode.CONVERSATION_NOT_FOUND,
                        "Conversation " + conversationId + " not found"));
    }

    private ConversationTurn applyTransition(UUID conversationId, AdvanceResult result, OffsetDateTime now) {
        FeConversation next = result.conversation();
        int affected = conversationStore.casUpdate(conversationId,
                c -> c.isActive()
                        && Objects.equals(c.getCurrentBlockId(), result.fromBlockId())
                        && sizeOf(c.getInteractions()) == result.fromInteractionCount(),
                c -> copyTransition(next, c));
        if (affected == 0) {
            log.warn("Stale transition for convId={} from block {}; another input was applied first",
                    conversationId, result.fromBlockId());
            audit.audit(FunnelAuditStage.STALE_TRANSITION, conversationId, Map.of("fromBlockId", result.fromBlockId()));
            throw new FunnelEngineException(FunnelEngineErrorCode.STALE_TRANSITION,
                    "Conversation " + conversationId + " is no longer at block " + result.fromBlockId());
        }

        if (result.botOutput() != null) {
            conversationStore.appendMessage(conversationId, MessageRole.BOT, result.botOutput(), now);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("fromBlockId", result.fromBlockId());
        payload.put("toBlockId", next.getCurrentBlockId());
        payload.put("outcome", result.outcome().name());
        audit.audit(FunnelAuditStage.INPUT_ACCEPTED, conversationId, payload);
        if (result.outcome() == AdvanceOutcome.CLOSED) {
            log.info("Conversation {} closed at block {}", conversationId, result.fromBlockId());
            audit.audit(FunnelAuditStage.CONVERSATION_CLOSED, conversationId, Map.of("blockId", result.fromBlockId()));
        }
        else {
            log.info("Conversation {} advanced {} -> {}", conversationId, result.fromBlockId(), next.getCurrentBlockId());
        }

        List<GuardResult> fired = runSideEffects(result.sideEffects());
        return new ConversationTurn(reload(next), result.botOutput(), result.outcome(), fired);
    }

    private List<GuardResult> runSideEffects(List<SideEffectRequest> requests) {
        List<GuardResult> results = new ArrayList<>();
        for (SideEffectRequest request : requests) {
            try {
                results.add(sideEffectGuard.runOnce(request));
            }
            catch (FunnelEngineException e) {
                // the transition is already persisted; the offer sweep retries unclaimed actions
                log.error("Side effect {} could not run for convId={}: {}",
                        request.actionKey(), request.conversationId(), e.getMessage(), e);
            }
        }
        return results;
    }

    private void copyTransition(FeConversation from, FeConversation to) {
        to.setCurrentBlockId(from.getCurrentBlockId());
        to.setUserPath(new ArrayList<>(from.getUserPath()));
        to.setInteractions(new ArrayList<>(from.getInteractions()));
        to.setStatus(from.getStatus());
        to.setClosedAt(from.getClosedAt());
        to.setPhaseStartTime(from.getPhaseStartTime());
        to.setUpdatedAt(from.getUpdatedAt());
        if (from.getResolvedLinks() != null) {
            if (to.getResolvedLinks() == null) {
                to.setResolvedLinks(new LinkedHashMap<>());
            }
            from.getResolvedLinks().forEach(to.getResolvedLinks()::putIfAbsent);
        }
    }

    private FeConversation reload(FeConversation fallback) {
        return conversationStore.load(fallback.getConversationId()).orElse(fallback);
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
