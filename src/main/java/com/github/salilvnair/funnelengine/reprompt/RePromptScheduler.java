package com.github.salilvnair.funnelengine.reprompt;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.engine.phase.FunnelPhase;
import com.github.salilvnair.funnelengine.engine.phase.PhaseDetector;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pure timing policy for re-prompts. A nudge is due only when the whole-minute age of the
 * phase anchor equals one of the phase's offsets exactly.
 */
@Component
@RequiredArgsConstructor
public class RePromptScheduler {

    private final FunnelEngineConfig config;
    private final PhaseDetector phaseDetector;
    private final Clock clock;

    public Optional<RePromptDue> dueRePrompt(FeConversation conversation, FunnelGraph graph) {
        return dueRePrompt(conversation, graph, OffsetDateTime.now(clock));
    }

    public Optional<RePromptDue> dueRePrompt(FeConversation conversation, FunnelGraph graph, OffsetDateTime now) {
        if (!conversation.isActive()) {
            return Optional.empty();
        }
        FunnelPhase phase = phaseDetector.phaseOf(graph, conversation.getCurrentBlockId());
        if (!phase.isRePromptable()) {
            return Optional.empty();
        }
        OffsetDateTime anchor = phase == FunnelPhase.PHASE1 ? conversation.getCreatedAt() : conversation.getPhaseStartTime();
        if (anchor == null) {
            return Optional.empty();
        }
        long seconds = Duration.between(anchor, now).getSeconds();
        if (seconds < 0) {
            return Optional.empty();
        }
        long ageMinutes = Math.floorDiv(seconds, 60L);
        if (!offsetsFor(phase).contains((int) Math.min(ageMinutes, Integer.MAX_VALUE))) {
            return Optional.empty();
        }
        int offset = (int) ageMinutes;
        return Optional.of(new RePromptDue(phase, offset, messageFor(phase, offset)));
    }

    public List<Integer> offsetsFor(FunnelPhase phase) {
        return phase == FunnelPhase.PHASE1
                ? config.getReprompt().getPhase1Offsets()
                : config.getReprompt().getPhase2Offsets();
    }

    public String messageFor(FunnelPhase phase, int offsetMinutes) {
        Map<Integer, String> byOffset = config.getReprompt().getMessages().get(phase.name());
        String message = byOffset == null ? null : byOffset.get(offsetMinutes);
        if (message == null || message.isBlank()) {
            throw new FunnelEngineException(FunnelEngineErrorCode.REPROMPT_MESSAGE_MISSING,
                    "No re-prompt message configured for " + phase + " at " + offsetMinutes + " minutes");
        }
        return message;
    }
}
