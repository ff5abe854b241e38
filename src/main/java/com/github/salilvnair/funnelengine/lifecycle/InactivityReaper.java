package com.github.salilvnair.funnelengine.lifecycle;

import com.github.salilvnair.funnelengine.audit.AuditService;
import com.github.salilvnair.funnelengine.audit.FunnelAuditStage;
import com.github.salilvnair.funnelengine.batch.BatchReport;
import com.github.salilvnair.funnelengine.batch.BatchRun;
import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.entity.ConversationStatus;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.spi.ActiveConversationFilter;
import com.github.salilvnair.funnelengine.spi.ConversationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Closes active conversations that have been silent for at least the inactivity threshold.
 * Closing is conditional on the record still being active, so repeated or concurrent runs
 * change nothing twice.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InactivityReaper {

    static final String BATCH_NAME = "InactivityReaper";

    private final ConversationStore conversationStore;
    private final FunnelEngineConfig config;
    private final AuditService audit;
    private final Clock clock;

    public BatchReport reap() {
        return reap(ActiveConversationFilter.all());
    }

    public BatchReport reap(ActiveConversationFilter filter) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Duration threshold = config.getLifecycle().getInactivityThreshold();
        return BatchRun.over(BATCH_NAME, conversationStore.listActive(filter), c -> closeIfInactive(c, now, threshold));
    }

    public boolean isInactive(FeConversation conversation, OffsetDateTime now, Duration threshold) {
        OffsetDateTime lastActivity = conversation.lastActivityAt();
        return lastActivity != null && Duration.between(lastActivity, now).compareTo(threshold) >= 0;
    }

    private boolean closeIfInactive(FeConversation conversation, OffsetDateTime now, Duration threshold) {
        if (!isInactive(conversation, now, threshold)) {
            return false;
        }
        int affected = conversationStore.casUpdate(conversation.getConversationId(),
                c -> c.isActive() && isInactive(c, now, threshold),
                c -> {
                    c.setStatus(ConversationStatus.CLOSED);
                    c.setClosedAt(now);
                    c.setUpdatedAt(now);
                });
        if (affected == 0) {
            return false;
        }
        log.info("Closed inactive conversation {} (last activity {})", conversation.getConversationId(), conversation.lastActivityAt());
        audit.audit(FunnelAuditStage.CONVERSATION_REAPED, conversation.getConversationId(),
                Map.of("lastActivityAt", String.valueOf(conversation.lastActivityAt()), "threshold", threshold.toString()));
        return true;
    }
}
