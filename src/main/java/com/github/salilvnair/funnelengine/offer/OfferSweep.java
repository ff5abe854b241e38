package com.github.salilvnair.funnelengine.offer;

import com.github.salilvnair.funnelengine.action.AffiliateDmAction;
import com.github.salilvnair.funnelengine.batch.BatchReport;
import com.github.salilvnair.funnelengine.batch.BatchRun;
import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.engine.exception.OrphanedConversationException;
import com.github.salilvnair.funnelengine.engine.model.SideEffectRequest;
import com.github.salilvnair.funnelengine.engine.phase.TriggerStagePolicy;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import com.github.salilvnair.funnelengine.guard.GuardOutcome;
import com.github.salilvnair.funnelengine.guard.GuardResult;
import com.github.salilvnair.funnelengine.guard.SideEffectGuard;
import com.github.salilvnair.funnelengine.service.FunnelGraphRegistry;
import com.github.salilvnair.funnelengine.spi.ActiveConversationFilter;
import com.github.salilvnair.funnelengine.spi.ConversationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Retry path for the one-time action: conversations sitting in a trigger stage with the
 * action still unclaimed, idle for at least the settle time, go through the guard again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfferSweep {

    static final String BATCH_NAME = "OfferSweep";

    private final ConversationStore conversationStore;
    private final FunnelGraphRegistry graphRegistry;
    private final TriggerStagePolicy triggerStagePolicy;
    private final SideEffectGuard sideEffectGuard;
    private final FunnelEngineConfig config;
    private final Clock clock;

    public BatchReport sweep() {
        return sweep(ActiveConversationFilter.unclaimed());
    }

    public BatchReport sweep(ActiveConversationFilter filter) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        ActiveConversationFilter unclaimed = new ActiveConversationFilter(filter.funnelId(), filter.scope(), true);
        return BatchRun.over(BATCH_NAME, conversationStore.listActive(unclaimed), c -> fireIfSettled(c, now));
    }

    private boolean fireIfSettled(FeConversation conversation, OffsetDateTime now) {
        if (conversation.isOneTimeActionClaimed()) {
            return false;
        }
        Duration settle = config.getGuard().getOfferSettleTime();
        OffsetDateTime lastActivity = conversation.lastActivityAt();
        if (lastActivity == null || Duration.between(lastActivity, now).compareTo(settle) < 0) {
            return false;
        }
        FunnelGraph graph = graphRegistry.graphFor(conversation.getFunnelId()).graph();
        FunnelBlock block = graph.resolveBlock(conversation.getCurrentBlockId())
                .orElseThrow(() -> new OrphanedConversationException(
                        conversation.getConversationId(), conversation.getCurrentBlockId()));
        if (!triggerStagePolicy.isTriggerBlock(graph, block.id())) {
            return false;
        }

        GuardResult result = sideEffectGuard.runOnce(new SideEffectRequest(
                conversation.getConversationId(),
                AffiliateDmAction.ACTION_KEY,
                block.id(),
                block.resourceName()
        ));
        if (result.outcome() == GuardOutcome.RELEASED_AFTER_FAILURE) {
            throw new FunnelEngineException(FunnelEngineErrorCode.DELIVERY_FAILED,
                    "Offer message for block " + block.id() + " failed: " + result.error());
        }
        return result.outcome().fired();
    }
}
