package com.github.salilvnair.funnelengine.reprompt;

import com.github.salilvnair.funnelengine.audit.AuditService;
import com.github.salilvnair.funnelengine.audit.FunnelAuditStage;
import com.github.salilvnair.funnelengine.batch.BatchReport;
import com.github.salilvnair.funnelengine.batch.BatchRun;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.entity.MessageRole;
import com.github.salilvnair.funnelengine.service.FunnelGraphRegistry;
import com.github.salilvnair.funnelengine.spi.ActiveConversationFilter;
import com.github.salilvnair.funnelengine.spi.ConversationStore;
import com.github.salilvnair.funnelengine.spi.DeliveryReceipt;
import com.github.salilvnair.funnelengine.spi.MessageDelivery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sends due re-prompts. The {@code (phase, offset)} slot is claimed on the conversation
 * before delivery so overlapping ticks within the same minute send it once; a failed
 * delivery puts the previous slot back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RePromptDispatcher {

    static final String BATCH_NAME = "RePromptDispatcher";

    private final ConversationStore conversationStore;
    private final RePromptScheduler scheduler;
    private final FunnelGraphRegistry graphRegistry;
    private final MessageDelivery messageDelivery;
    private final AuditService audit;
    private final Clock clock;

    public BatchReport dispatch() {
        return dispatch(ActiveConversationFilter.all());
    }

    public BatchReport dispatch(ActiveConversationFilter filter) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return BatchRun.over(BATCH_NAME, conversationStore.listActive(filter), c -> sendIfDue(c, now));
    }

    private boolean sendIfDue(FeConversation conversation, OffsetDateTime now) {
        Optional<RePromptDue> due = scheduler.dueRePrompt(conversation,
                graphRegistry.graphFor(conversation.getFunnelId()).graph(), now);
        if (due.isEmpty()) {
            return false;
        }
        String key = due.get().key();
        String previousKey = conversation.getLastRePromptKey();
        if (key.equals(previousKey)) {
            return false;
        }
        int claimed = conversationStore.casUpdate(conversation.getConversationId(),
                c -> c.isActive() && !key.equals(c.getLastRePromptKey()),
                c -> {
                    c.setLastRePromptKey(key);
                    c.setUpdatedAt(now);
                });
        if (claimed == 0) {
            log.debug("Re-prompt {} already taken for convId={}", key, conversation.getConversationId());
            return false;
        }

        DeliveryReceipt receipt = deliver(conversation, due.get().message());
        if (!receipt.success()) {
            conversationStore.casUpdate(conversation.getConversationId(),
                    c -> key.equals(c.getLastRePromptKey()),
                    c -> c.setLastRePromptKey(previousKey));
            audit.audit(FunnelAuditStage.REPROMPT_FAILED, conversation.getConversationId(),
                    Map.of("key", key, "error", String.valueOf(receipt.error())));
            throw new FunnelEngineException(FunnelEngineErrorCode.DELIVERY_FAILED,
                    "Re-prompt " + key + " could not be delivered: " + receipt.error());
        }

        conversationStore.appendMessage(conversation.getConversationId(), MessageRole.BOT, due.get().message(), now);
        log.info("Sent re-prompt {} to convId={}", key, conversation.getConversationId());
        audit.audit(FunnelAuditStage.REPROMPT_SENT, conversation.getConversationId(),
                Map.of("key", key, "message", due.get().message()));
        return true;
    }

    private DeliveryReceipt deliver(FeConversation conversation, String text) {
        try {
            return Objects.requireNonNullElseGet(messageDelivery.deliver(conversation.getTargetUserRef(), text),
                    () -> DeliveryReceipt.failed("delivery returned no receipt"));
        }
        catch (RuntimeException e) {
            log.warn("Delivery threw for convId={}: {}", conversation.getConversationId(), e.getMessage());
            return DeliveryReceipt.failed(e.getMessage());
        }
    }
}
