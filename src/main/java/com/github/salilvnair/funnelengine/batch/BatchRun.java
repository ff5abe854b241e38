package com.github.salilvnair.funnelengine.batch;

import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one item handler per conversation, collecting per-item errors and stopping between
 * items when the thread is interrupted.
 */
@Slf4j
public final class BatchRun {

    @FunctionalInterface
    public interface ItemHandler {
        /**
         * @return {@code true} if the item's state was changed
         */
        boolean handle(FeConversation conversation);
    }

    private BatchRun() {
    }

    public static BatchReport over(String batch, List<FeConversation> items, ItemHandler handler) {
        int affected = 0;
        int scanned = 0;
        List<BatchItemError> errors = new ArrayList<>();
        boolean interrupted = false;
        for (FeConversation conversation : items) {
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                log.warn("{} interrupted after {} of {} conversations", batch, scanned, items.size());
                break;
            }
            scanned++;
            try {
                if (handler.handle(conversation)) {
                    affected++;
                }
            }
            catch (FunnelEngineException e) {
                log.warn("{} failed for convId={}: {}", batch, conversation.getConversationId(), e.getMessage());
                errors.add(new BatchItemError(conversation.getConversationId(), e.getErrorCode(), e.getMessage()));
            }
            catch (RuntimeException e) {
                log.error("{} failed unexpectedly for convId={}", batch, conversation.getConversationId(), e);
                errors.add(new BatchItemError(conversation.getConversationId(),
                        FunnelEngineErrorCode.INTERNAL_ERROR.name(), String.valueOf(e.getMessage())));
            }
        }
        BatchReport report = new BatchReport(batch, scanned, affected, errors, interrupted);
        log.info("{} finished: scanned={} affected={} errors={}", batch, scanned, affected, errors.size());
        return report;
    }
}
